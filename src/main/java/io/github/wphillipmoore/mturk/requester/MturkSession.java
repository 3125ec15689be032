package io.github.wphillipmoore.mturk.requester;

import io.github.wphillipmoore.mturk.requester.auth.AwsCredentials;
import io.github.wphillipmoore.mturk.requester.config.EndpointConfig;
import io.github.wphillipmoore.mturk.requester.config.Mode;
import io.github.wphillipmoore.mturk.requester.config.MturkConfig;
import io.github.wphillipmoore.mturk.requester.exception.MturkMissingParameterException;
import io.github.wphillipmoore.mturk.requester.exception.MturkNotAuthorizedException;
import io.github.wphillipmoore.mturk.requester.exception.MturkRequestException;
import io.github.wphillipmoore.mturk.requester.exception.MturkTransportException;
import io.github.wphillipmoore.mturk.requester.exception.MturkUnclassifiedException;
import io.github.wphillipmoore.mturk.requester.request.OperationSpec;
import io.github.wphillipmoore.mturk.requester.request.Operations;
import io.github.wphillipmoore.mturk.requester.request.ParameterBag;
import io.github.wphillipmoore.mturk.requester.request.RequestBuilder;
import io.github.wphillipmoore.mturk.requester.request.SignedRequest;
import io.github.wphillipmoore.mturk.requester.response.ResponseClassifier;
import io.github.wphillipmoore.mturk.requester.response.XmlResponseDecoder;
import io.github.wphillipmoore.mturk.requester.signing.RequestSigner;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central session class for the Mechanical Turk requester API.
 *
 * <p>Builds and signs each request, sends it through the {@link MturkTransport}, decodes the XML
 * response and classifies it. Every call is one synchronous GET; nothing is retried.
 *
 * <p>Instances are created via the {@link Builder}:
 *
 * <pre>{@code
 * MturkSession session = new MturkSession.Builder(
 *         new AwsCredentials("AKID", "secret"))
 *     .config(MturkConfig.loadDefault())
 *     .mode(Mode.SANDBOX)
 *     .transport(new HttpClientTransport())
 *     .build();
 * Map<String, Object> balance = session.getAccountBalance();
 * }</pre>
 *
 * <p>Credentials and the endpoint are fixed for the lifetime of a session; {@link #withMode(Mode)}
 * returns a new session rather than switching this one. The {@code getLast*} accessors reflect the
 * most recent call, so a session should not be shared between threads.
 */
public final class MturkSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(MturkSession.class);
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final AwsCredentials credentials;
  private final MturkConfig config;
  private final EndpointConfig endpoint;
  private final MturkTransport transport;
  private final @Nullable Duration timeout;
  private final Clock clock;
  private final RequestBuilder requestBuilder;

  private @Nullable String lastOperation;
  private @Nullable Integer lastHttpStatus;
  private @Nullable String lastResponseText;
  private @Nullable Map<String, Object> lastResponseTree;

  private MturkSession(Builder builder) {
    this(
        builder.credentials,
        builder.config,
        builder.mode,
        Objects.requireNonNull(builder.transport, "transport"),
        builder.timeout,
        builder.clock);
  }

  private MturkSession(
      AwsCredentials credentials,
      MturkConfig config,
      Mode mode,
      MturkTransport transport,
      @Nullable Duration timeout,
      Clock clock) {
    this.credentials = credentials;
    this.config = config;
    this.endpoint = config.forMode(mode);
    this.transport = transport;
    this.timeout = timeout;
    this.clock = clock;
    this.requestBuilder = new RequestBuilder(credentials, new RequestSigner(credentials, clock));
  }

  /**
   * Returns a session bound to the given mode, sharing this session's credentials, configuration
   * and transport. This session is left unchanged.
   *
   * @param mode the mode of the new session
   * @return a session for {@code mode}, or this session if it is already bound to it
   */
  public MturkSession withMode(Mode mode) {
    Objects.requireNonNull(mode, "mode");
    if (mode == endpoint.mode()) {
      return this;
    }
    return new MturkSession(credentials, config, mode, transport, timeout, clock);
  }

  /** Returns the mode this session is bound to. */
  public Mode getMode() {
    return endpoint.mode();
  }

  /** Returns the endpoint configuration this session sends requests to. */
  public EndpointConfig getEndpoint() {
    return endpoint;
  }

  /** Returns the default parameters merged into every request of this session. */
  public ParameterBag getDefaults() {
    return endpoint.defaults();
  }

  /** Returns the wire name of the last operation sent, or {@code null} before any call. */
  public @Nullable String getLastOperation() {
    return lastOperation;
  }

  /** Returns the HTTP status code of the last call, or {@code null} before any response. */
  public @Nullable Integer getLastHttpStatus() {
    return lastHttpStatus;
  }

  /** Returns the raw response text of the last call, or {@code null} before any response. */
  public @Nullable String getLastResponseText() {
    return lastResponseText;
  }

  /**
   * Returns the decoded response tree of the last call, or {@code null} before any response or
   * when the last body could not be decoded. The returned map is unmodifiable.
   */
  public @Nullable Map<String, Object> getLastResponseTree() {
    return lastResponseTree;
  }

  /**
   * Builds the signed request for an operation without sending it.
   *
   * @param operation the operation
   * @param params the caller's parameters, or {@code null} for none
   * @return the signed request
   * @throws MturkMissingParameterException if a required parameter is absent
   */
  public SignedRequest prepare(OperationSpec operation, @Nullable ParameterBag params) {
    Objects.requireNonNull(operation, "operation");
    return requestBuilder.build(
        endpoint.baseUrl(),
        operation,
        params != null ? params : ParameterBag.empty(),
        endpoint.defaults());
  }

  /**
   * Executes an operation.
   *
   * <p>The session's default parameters are merged under {@code params} before the required keys
   * are checked, so a default can satisfy a required key.
   *
   * @param operation the operation
   * @param params the caller's parameters, or {@code null} for none
   * @return the decoded response tree
   * @throws MturkMissingParameterException if a required parameter is absent; nothing is sent
   * @throws MturkNotAuthorizedException if the service rejected the credentials
   * @throws MturkRequestException if the service rejected the request
   * @throws MturkUnclassifiedException if the response fits no known pattern
   * @throws MturkTransportException if the request could not be sent
   */
  public Map<String, Object> invoke(OperationSpec operation, @Nullable ParameterBag params) {
    SignedRequest request = prepare(operation, params);
    lastOperation = operation.name();
    lastHttpStatus = null;
    lastResponseText = null;
    lastResponseTree = null;

    LOGGER.debug("Sending {} to {} endpoint", operation.name(), endpoint.mode());
    TransportResponse response = transport.get(request.url(), timeout);
    lastHttpStatus = response.statusCode();
    lastResponseText = response.body();
    LOGGER.debug("{} returned HTTP {}", operation.name(), response.statusCode());

    Map<String, Object> tree = XmlResponseDecoder.decode(response);
    lastResponseTree = Collections.unmodifiableMap(new LinkedHashMap<>(tree));
    return ResponseClassifier.classify(response.statusCode(), tree, operation.resultKey());
  }

  // HITs

  /** Creates a HIT from an existing HIT type and layout. Result element {@code HIT}. */
  public Map<String, Object> createHitByTypeIdAndLayoutId(@Nullable ParameterBag params) {
    return invoke(Operations.CREATE_HIT_BY_TYPE_ID_AND_LAYOUT_ID, params);
  }

  /** Creates a HIT from an existing layout with inline HIT type properties. */
  public Map<String, Object> createHitByLayoutId(@Nullable ParameterBag params) {
    return invoke(Operations.CREATE_HIT_BY_LAYOUT_ID, params);
  }

  /** Registers a new HIT type. */
  public Map<String, Object> registerHitType(@Nullable ParameterBag params) {
    return invoke(Operations.REGISTER_HIT_TYPE, params);
  }

  /** Creates, updates, disables or re-enables notifications for a HIT type. */
  public Map<String, Object> setHitTypeNotification(@Nullable ParameterBag params) {
    return invoke(Operations.SET_HIT_TYPE_NOTIFICATION, params);
  }

  /** Changes the HIT type of a HIT. */
  public Map<String, Object> changeHitTypeOfHit(@Nullable ParameterBag params) {
    return invoke(Operations.CHANGE_HIT_TYPE_OF_HIT, params);
  }

  /** Retrieves a HIT. */
  public Map<String, Object> getHit(@Nullable ParameterBag params) {
    return invoke(Operations.GET_HIT, params);
  }

  /** Lists the requester's HITs. */
  public Map<String, Object> searchHits(@Nullable ParameterBag params) {
    return invoke(Operations.SEARCH_HITS, params);
  }

  /** Lists HITs in the reviewable or reviewing state. */
  public Map<String, Object> getReviewableHits(@Nullable ParameterBag params) {
    return invoke(Operations.GET_REVIEWABLE_HITS, params);
  }

  /** Moves a HIT between the reviewable and reviewing states. */
  public Map<String, Object> setHitAsReviewing(@Nullable ParameterBag params) {
    return invoke(Operations.SET_HIT_AS_REVIEWING, params);
  }

  /** Extends the expiration or the maximum assignments of a HIT. */
  public Map<String, Object> extendHit(@Nullable ParameterBag params) {
    return invoke(Operations.EXTEND_HIT, params);
  }

  /** Expires a HIT immediately. */
  public Map<String, Object> forceExpireHit(@Nullable ParameterBag params) {
    return invoke(Operations.FORCE_EXPIRE_HIT, params);
  }

  /** Removes a HIT that is not yet reviewable, with its assignment data. */
  public Map<String, Object> disableHit(@Nullable ParameterBag params) {
    return invoke(Operations.DISABLE_HIT, params);
  }

  /** Disposes of a reviewable HIT. */
  public Map<String, Object> disposeHit(@Nullable ParameterBag params) {
    return invoke(Operations.DISPOSE_HIT, params);
  }

  // Assignments

  /** Lists the completed assignments of a HIT. */
  public Map<String, Object> getAssignmentsForHit(@Nullable ParameterBag params) {
    return invoke(Operations.GET_ASSIGNMENTS_FOR_HIT, params);
  }

  /** Retrieves an assignment. */
  public Map<String, Object> getAssignment(@Nullable ParameterBag params) {
    return invoke(Operations.GET_ASSIGNMENT, params);
  }

  /** Approves a submitted assignment. */
  public Map<String, Object> approveAssignment(@Nullable ParameterBag params) {
    return invoke(Operations.APPROVE_ASSIGNMENT, params);
  }

  /** Rejects a submitted assignment. */
  public Map<String, Object> rejectAssignment(@Nullable ParameterBag params) {
    return invoke(Operations.REJECT_ASSIGNMENT, params);
  }

  /** Approves a previously rejected assignment. */
  public Map<String, Object> approveRejectedAssignment(@Nullable ParameterBag params) {
    return invoke(Operations.APPROVE_REJECTED_ASSIGNMENT, params);
  }

  /** Returns a temporary URL for a file a worker uploaded as an answer. */
  public Map<String, Object> getFileUploadUrl(@Nullable ParameterBag params) {
    return invoke(Operations.GET_FILE_UPLOAD_URL, params);
  }

  // Notifications

  /** Asks the service to send a test notification. */
  public Map<String, Object> sendTestEventNotification(@Nullable ParameterBag params) {
    return invoke(Operations.SEND_TEST_EVENT_NOTIFICATION, params);
  }

  /** E-mails a worker. */
  public Map<String, Object> notifyWorkers(@Nullable ParameterBag params) {
    return invoke(Operations.NOTIFY_WORKERS, params);
  }

  // Payments and statistics

  /**
   * Pays a bonus to a worker. Pass a {@code UniqueRequestToken} to make retries safe; it is sent
   * unchanged.
   */
  public Map<String, Object> grantBonus(@Nullable ParameterBag params) {
    return invoke(Operations.GRANT_BONUS, params);
  }

  /** Lists bonuses paid for a HIT or assignment. */
  public Map<String, Object> getBonusPayments(@Nullable ParameterBag params) {
    return invoke(Operations.GET_BONUS_PAYMENTS, params);
  }

  /** Retrieves the account balance. */
  public Map<String, Object> getAccountBalance() {
    return invoke(Operations.GET_ACCOUNT_BALANCE, null);
  }

  /** Retrieves a requester statistic. Result element {@code GetStatisticResult}. */
  public Map<String, Object> getRequesterStatistic(@Nullable ParameterBag params) {
    return invoke(Operations.GET_REQUESTER_STATISTIC, params);
  }

  /** Retrieves a statistic about one worker. Result element {@code GetStatisticResult}. */
  public Map<String, Object> getRequesterWorkerStatistic(@Nullable ParameterBag params) {
    return invoke(Operations.GET_REQUESTER_WORKER_STATISTIC, params);
  }

  // Workers

  /** Blocks a worker from the requester's HITs. */
  public Map<String, Object> blockWorker(@Nullable ParameterBag params) {
    return invoke(Operations.BLOCK_WORKER, params);
  }

  /** Lifts a worker block. */
  public Map<String, Object> unblockWorker(@Nullable ParameterBag params) {
    return invoke(Operations.UNBLOCK_WORKER, params);
  }

  /** Lists blocked workers. */
  public Map<String, Object> getBlockedWorkers(@Nullable ParameterBag params) {
    return invoke(Operations.GET_BLOCKED_WORKERS, params);
  }

  /** Builder for {@link MturkSession}. */
  public static final class Builder {

    private final AwsCredentials credentials;
    private MturkConfig config = MturkConfig.defaults();
    private Mode mode = Mode.PRODUCTION;
    private @Nullable MturkTransport transport;
    private @Nullable Duration timeout = DEFAULT_TIMEOUT;
    private Clock clock = Clock.systemUTC();

    /**
     * Creates a builder with the required session parameters.
     *
     * @param credentials the credentials signing every request
     */
    public Builder(AwsCredentials credentials) {
      this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    /** Sets the transport implementation. Required before calling {@link #build()}. */
    public Builder transport(MturkTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /** Sets the endpoints and defaults. Defaults to {@link MturkConfig#defaults()}. */
    public Builder config(MturkConfig config) {
      this.config = Objects.requireNonNull(config, "config");
      return this;
    }

    /** Sets the mode. Defaults to {@link Mode#PRODUCTION}. */
    public Builder mode(Mode mode) {
      this.mode = Objects.requireNonNull(mode, "mode");
      return this;
    }

    /** Sets the request timeout. Defaults to 30 seconds. Pass {@code null} for no timeout. */
    public Builder timeout(@Nullable Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /** Sets the clock used to timestamp requests. Package-private for testing. */
    Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Builds the session.
     *
     * @return the configured session
     * @throws NullPointerException if transport has not been set
     */
    public MturkSession build() {
      Objects.requireNonNull(transport, "transport");
      return new MturkSession(this);
    }
  }
}

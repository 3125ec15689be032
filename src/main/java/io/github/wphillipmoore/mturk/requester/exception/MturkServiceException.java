package io.github.wphillipmoore.mturk.requester.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when the service answered with a structured error envelope.
 *
 * <p>The {@code errors} map is the raw {@code Errors} node of the decoded response, copied and
 * unmodifiable. Its {@code Error} entry holds either a single {@code {Code, Message}} record or a
 * list of them; {@link #getServiceErrors()} flattens both shapes.
 */
public abstract sealed class MturkServiceException extends MturkException
    permits MturkNotAuthorizedException, MturkRequestException {

  private static final long serialVersionUID = 1L;

  private final Map<String, Object> errors;
  private final @Nullable Integer statusCode;

  /**
   * Creates a service exception.
   *
   * @param message description of the failure
   * @param errors the raw {@code Errors} node of the response
   * @param statusCode the HTTP status code, or {@code null} if unavailable
   */
  protected MturkServiceException(
      String message, Map<String, Object> errors, @Nullable Integer statusCode) {
    super(message);
    this.errors =
        Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(errors, "errors")));
    this.statusCode = statusCode;
  }

  /**
   * Returns the raw {@code Errors} node. The returned map is unmodifiable.
   *
   * @return the errors node
   */
  public Map<String, Object> getErrors() {
    return errors;
  }

  /**
   * Returns the HTTP status code, or {@code null} if the status code was not available.
   *
   * @return the status code, or {@code null}
   */
  public @Nullable Integer getStatusCode() {
    return statusCode;
  }

  /**
   * Returns the individual error records carried by the {@code Errors} node, in document order.
   *
   * @return the error records, possibly empty
   */
  public List<ServiceError> getServiceErrors() {
    Object error = errors.get("Error");
    List<ServiceError> result = new ArrayList<>();
    if (error instanceof List<?> list) {
      for (Object item : list) {
        addServiceError(item, result);
      }
    } else {
      addServiceError(error, result);
    }
    return List.copyOf(result);
  }

  private static void addServiceError(@Nullable Object node, List<ServiceError> result) {
    if (node instanceof Map<?, ?> map) {
      result.add(new ServiceError(textOf(map.get("Code")), textOf(map.get("Message"))));
    }
  }

  private static String textOf(@Nullable Object value) {
    return value instanceof String s ? s : "";
  }
}

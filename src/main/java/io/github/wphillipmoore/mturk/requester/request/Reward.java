package io.github.wphillipmoore.mturk.requester.request;

import java.math.BigDecimal;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The price paid per assignment.
 *
 * @param amount the amount, never null or negative
 * @param currencyCode the ISO currency code (the service only accepts {@code USD})
 * @param formattedPrice an optional display form such as {@code $0.50}
 * @see <a
 *     href="https://docs.aws.amazon.com/AWSMechTurk/latest/AWSMturkAPI/ApiReference_PriceDataStructureArticle.html">Price</a>
 */
public record Reward(BigDecimal amount, String currencyCode, @Nullable String formattedPrice) {

  /** Validates the amount and currency. */
  public Reward {
    Objects.requireNonNull(amount, "amount");
    Objects.requireNonNull(currencyCode, "currencyCode");
    if (amount.signum() < 0) {
      throw new IllegalArgumentException("amount must not be negative");
    }
  }

  /** Creates a reward without a formatted price. */
  public Reward(BigDecimal amount, String currencyCode) {
    this(amount, currencyCode, null);
  }

  /** Creates a US dollar reward. */
  public static Reward usd(String amount) {
    return new Reward(new BigDecimal(amount), "USD");
  }
}

package io.github.wphillipmoore.mturk.requester.request;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A condition a worker must meet to accept (or preview) a HIT.
 *
 * @param qualificationTypeId the qualification type, never null
 * @param comparator the comparison, e.g. {@code GreaterThan} or {@code In}, never null
 * @param integerValue the integer compared against, or {@code null}
 * @param localeValues the locales compared against, never null, possibly empty
 * @param requiredToPreview whether the requirement also gates previews, or {@code null}
 * @see <a
 *     href="https://docs.aws.amazon.com/AWSMechTurk/latest/AWSMturkAPI/ApiReference_QualificationRequirementDataStructureArticle.html">QualificationRequirement</a>
 */
public record QualificationRequirement(
    String qualificationTypeId,
    String comparator,
    @Nullable Integer integerValue,
    List<LocaleValue> localeValues,
    @Nullable Boolean requiredToPreview) {

  /** Validates required fields and copies the locale list. */
  public QualificationRequirement {
    Objects.requireNonNull(qualificationTypeId, "qualificationTypeId");
    Objects.requireNonNull(comparator, "comparator");
    localeValues = List.copyOf(Objects.requireNonNull(localeValues, "localeValues"));
  }

  /** Creates an integer comparison requirement. */
  public static QualificationRequirement ofInteger(
      String qualificationTypeId, String comparator, int integerValue) {
    return new QualificationRequirement(
        qualificationTypeId, comparator, integerValue, List.of(), null);
  }

  /** Creates a locale comparison requirement. */
  public static QualificationRequirement ofLocales(
      String qualificationTypeId, String comparator, List<LocaleValue> localeValues) {
    return new QualificationRequirement(
        qualificationTypeId, comparator, null, localeValues, null);
  }

  /** Returns a copy with {@code requiredToPreview} set. */
  public QualificationRequirement withRequiredToPreview(boolean requiredToPreview) {
    return new QualificationRequirement(
        qualificationTypeId, comparator, integerValue, localeValues, requiredToPreview);
  }
}

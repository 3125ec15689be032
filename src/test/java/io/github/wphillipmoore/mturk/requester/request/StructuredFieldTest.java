package io.github.wphillipmoore.mturk.requester.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.mturk.requester.exception.MturkMissingParameterException;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StructuredFieldTest {

  private static final String DESTINATION = "ops@example.com";

  private static NotificationSpec email(String... eventTypes) {
    return new NotificationSpec(DESTINATION, "Email", "2006-05-05", List.of(eventTypes));
  }

  @Nested
  class ForKey {

    @Test
    void findsEveryField() {
      for (StructuredField field : StructuredField.values()) {
        assertThat(StructuredField.forKey(field.key())).isSameAs(field);
      }
    }

    @Test
    void returnsNullForScalarKeys() {
      assertThat(StructuredField.forKey("Title")).isNull();
    }
  }

  @Nested
  class RewardField {

    @Test
    void encodesAmountAndCurrencyAtIndexOne() {
      ParameterBag params = ParameterBag.builder().reward(Reward.usd("0.05")).build();

      assertThat(StructuredField.REWARD.encode(params))
          .isEqualTo("&Reward.1.Amount=0.05&Reward.1.CurrencyCode=USD");
    }

    @Test
    void encodesFormattedPriceWhenPresent() {
      ParameterBag params =
          ParameterBag.builder()
              .reward(new Reward(new BigDecimal("0.50"), "USD", "$0.50"))
              .build();

      assertThat(StructuredField.REWARD.encode(params))
          .isEqualTo(
              "&Reward.1.Amount=0.50&Reward.1.CurrencyCode=USD&Reward.1.FormattedPrice=%240.50");
    }

    @Test
    void coercesGenericMap() {
      Map<String, Object> raw = new LinkedHashMap<>();
      raw.put("Amount", 0.25);
      raw.put("CurrencyCode", "USD");

      ParameterBag params = ParameterBag.of("Reward", raw);

      assertThat(params.getReward()).isEqualTo(new Reward(new BigDecimal("0.25"), "USD"));
    }

    @Test
    void genericMapWithoutCurrencyIsMissingParameter() {
      assertThatThrownBy(() -> ParameterBag.of("Reward", Map.of("Amount", "1.00")))
          .isInstanceOf(MturkMissingParameterException.class)
          .hasMessage("The Reward.CurrencyCode parameter is required.");
    }
  }

  @Nested
  class KeywordsField {

    @Test
    void joinsKeywordsWithEncodedCommas() {
      ParameterBag params = ParameterBag.builder().keywords("image", "tag ging").build();

      assertThat(StructuredField.KEYWORDS.encode(params)).isEqualTo("&Keywords=image%2Ctag+ging");
    }

    @Test
    void singleStringBecomesOneKeyword() {
      ParameterBag params = ParameterBag.of("Keywords", "images");

      assertThat(params.getKeywords()).containsExactly("images");
      assertThat(StructuredField.KEYWORDS.encode(params)).isEqualTo("&Keywords=images");
    }
  }

  @Nested
  class QualificationRequirementField {

    @Test
    void encodesIntegerAndLocaleRequirements() {
      ParameterBag params =
          ParameterBag.builder()
              .qualificationRequirements(
                  QualificationRequirement.ofInteger("00000000000000000040", "GreaterThan", 1000),
                  QualificationRequirement.ofLocales(
                      "00000000000000000071",
                      "In",
                      List.of(new LocaleValue("US", "NY"), new LocaleValue("CA"))))
              .build();

      assertThat(StructuredField.QUALIFICATION_REQUIREMENT.encode(params))
          .isEqualTo(
              "&QualificationRequirement.1.QualificationTypeId=00000000000000000040"
                  + "&QualificationRequirement.1.Comparator=GreaterThan"
                  + "&QualificationRequirement.1.IntegerValue=1000"
                  + "&QualificationRequirement.2.QualificationTypeId=00000000000000000071"
                  + "&QualificationRequirement.2.Comparator=In"
                  + "&QualificationRequirement.2.LocaleValue.1.Country=US"
                  + "&QualificationRequirement.2.LocaleValue.1.Subdivision=NY"
                  + "&QualificationRequirement.2.LocaleValue.2.Country=CA");
    }

    @Test
    void encodesRequiredToPreviewLast() {
      ParameterBag params =
          ParameterBag.builder()
              .qualificationRequirements(
                  QualificationRequirement.ofInteger("000000000000000000L0", "GreaterThan", 95)
                      .withRequiredToPreview(true))
              .build();

      assertThat(StructuredField.QUALIFICATION_REQUIREMENT.encode(params))
          .endsWith(
              "&QualificationRequirement.1.IntegerValue=95"
                  + "&QualificationRequirement.1.RequiredToPreview=true");
    }

    @Test
    void emptyListEncodesNothing() {
      ParameterBag params = ParameterBag.builder().qualificationRequirements(List.of()).build();

      assertThat(StructuredField.QUALIFICATION_REQUIREMENT.encode(params)).isEmpty();
    }

    @Test
    void coercesGenericMapsAsDecodedFromJson() {
      Map<String, Object> locale = new LinkedHashMap<>();
      locale.put("Country", "US");
      locale.put("Subdivision", "WA");
      Map<String, Object> requirement = new LinkedHashMap<>();
      requirement.put("QualificationTypeId", "00000000000000000071");
      requirement.put("Comparator", "EqualTo");
      requirement.put("IntegerValue", 5.0);
      requirement.put("LocaleValue", List.of(locale));

      ParameterBag params = ParameterBag.of("QualificationRequirement", List.of(requirement));

      assertThat(params.getQualificationRequirements())
          .containsExactly(
              new QualificationRequirement(
                  "00000000000000000071",
                  "EqualTo",
                  5,
                  List.of(new LocaleValue("US", "WA")),
                  null));
    }

    @Test
    void missingComparatorNamesFullPath() {
      List<Map<String, Object>> raw =
          List.of(
              Map.of("QualificationTypeId", "A", "Comparator", "Exists"),
              Map.of("QualificationTypeId", "B"));

      assertThatThrownBy(() -> ParameterBag.of("QualificationRequirement", raw))
          .isInstanceOf(MturkMissingParameterException.class)
          .hasMessage("The QualificationRequirement.2.Comparator parameter is required.");
    }

    @Test
    void missingLocaleCountryNamesFullPath() {
      Map<String, Object> requirement = new LinkedHashMap<>();
      requirement.put("QualificationTypeId", "A");
      requirement.put("Comparator", "In");
      requirement.put("LocaleValue", List.of(Map.of("Subdivision", "NY")));

      assertThatThrownBy(() -> ParameterBag.of("QualificationRequirement", List.of(requirement)))
          .isInstanceOf(MturkMissingParameterException.class)
          .extracting(e -> ((MturkMissingParameterException) e).getKey())
          .isEqualTo("QualificationRequirement.1.LocaleValue.1.Country");
    }

    private Map<String, Object> requirement(String name, Object value) {
      Map<String, Object> raw = new LinkedHashMap<>();
      raw.put("QualificationTypeId", "00000000000000000040");
      raw.put("Comparator", "GreaterThan");
      raw.put(name, value);
      return raw;
    }

    @Test
    void outOfRangeIntegerValueIsRejected() {
      Map<String, Object> raw = requirement("IntegerValue", 5_000_000_000L);

      assertThatThrownBy(() -> ParameterBag.of("QualificationRequirement", List.of(raw)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage(
              "QualificationRequirement.1.IntegerValue must be an integer, got 5000000000")
          .hasCauseInstanceOf(ArithmeticException.class);
    }

    @Test
    void fractionalIntegerValueIsRejected() {
      Map<String, Object> raw = requirement("IntegerValue", 2.7);

      assertThatThrownBy(() -> ParameterBag.of("QualificationRequirement", List.of(raw)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("QualificationRequirement.1.IntegerValue must be an integer, got 2.7");
    }

    @Test
    void nonNumericIntegerValueIsRejected() {
      Map<String, Object> raw = requirement("IntegerValue", "high");

      assertThatThrownBy(() -> ParameterBag.of("QualificationRequirement", List.of(raw)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageStartingWith("QualificationRequirement.1.IntegerValue must be an integer");
    }

    @Test
    void wholeIntegerValuesInOtherFormsAreAccepted() {
      ParameterBag params =
          ParameterBag.of(
              "QualificationRequirement",
              List.of(
                  requirement("IntegerValue", 95.0),
                  requirement("IntegerValue", 80L),
                  requirement("IntegerValue", "70")));

      assertThat(params.getQualificationRequirements())
          .extracting(QualificationRequirement::integerValue)
          .containsExactly(95, 80, 70);
    }

    @Test
    void numericRequiredToPreviewIsRejected() {
      Map<String, Object> raw = requirement("RequiredToPreview", 1);

      assertThatThrownBy(() -> ParameterBag.of("QualificationRequirement", List.of(raw)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("QualificationRequirement.1.RequiredToPreview must be true or false, got 1");
    }

    @Test
    void unknownRequiredToPreviewTextIsRejected() {
      Map<String, Object> raw = requirement("RequiredToPreview", "yes");

      assertThatThrownBy(() -> ParameterBag.of("QualificationRequirement", List.of(raw)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage(
              "QualificationRequirement.1.RequiredToPreview must be true or false, got yes");
    }

    @Test
    void requiredToPreviewAcceptsBooleansAndTextInAnyCase() {
      ParameterBag params =
          ParameterBag.of(
              "QualificationRequirement",
              List.of(
                  requirement("RequiredToPreview", true),
                  requirement("RequiredToPreview", "FALSE"),
                  requirement("RequiredToPreview", "True")));

      assertThat(params.getQualificationRequirements())
          .extracting(QualificationRequirement::requiredToPreview)
          .containsExactly(true, false, true);
      assertThat(StructuredField.QUALIFICATION_REQUIREMENT.encode(params))
          .contains("&QualificationRequirement.2.RequiredToPreview=false");
    }

    @Test
    void nonListIsRejected() {
      assertThatThrownBy(() -> ParameterBag.of("QualificationRequirement", "Exists"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("QualificationRequirement must be a list, got String");
    }
  }

  @Nested
  class HitLayoutParameterField {

    @Test
    void encodesNameValuePairs() {
      ParameterBag params =
          ParameterBag.builder()
              .layoutParameters(
                  new LayoutParameter("image_url", "https://example.com/a.png"),
                  new LayoutParameter("caption", "A cat"))
              .build();

      assertThat(StructuredField.HIT_LAYOUT_PARAMETER.encode(params))
          .isEqualTo(
              "&HITLayoutParameter.1.Name=image_url"
                  + "&HITLayoutParameter.1.Value=https%3A%2F%2Fexample.com%2Fa.png"
                  + "&HITLayoutParameter.2.Name=caption"
                  + "&HITLayoutParameter.2.Value=A+cat");
    }

    @Test
    void recordInsteadOfListIsRejected() {
      assertThatThrownBy(() -> ParameterBag.of("HITLayoutParameter", List.of("image_url")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("HITLayoutParameter.1 must be a record, got String");
    }
  }

  @Nested
  class NotificationField {

    @Test
    void singleEventTypeUsesNotificationIndex() {
      ParameterBag params =
          ParameterBag.builder()
              .notifications(email("AssignmentSubmitted"), email("HITExpired"))
              .build();

      assertThat(StructuredField.NOTIFICATION.encode(params))
          .isEqualTo(
              "&Notification.1.Destination=ops%40example.com"
                  + "&Notification.1.Transport=Email"
                  + "&Notification.1.Version=2006-05-05"
                  + "&Notification.1.EventType=AssignmentSubmitted"
                  + "&Notification.2.Destination=ops%40example.com"
                  + "&Notification.2.Transport=Email"
                  + "&Notification.2.Version=2006-05-05"
                  + "&Notification.2.EventType=HITExpired");
    }

    @Test
    void multipleEventTypesUseEventIndex() {
      ParameterBag params =
          ParameterBag.builder()
              .notifications(
                  email("AssignmentSubmitted"),
                  email("HITReviewable", "HITExpired", "AssignmentAbandoned"))
              .build();

      assertThat(StructuredField.NOTIFICATION.encode(params))
          .isEqualTo(
              "&Notification.1.Destination=ops%40example.com"
                  + "&Notification.1.Transport=Email"
                  + "&Notification.1.Version=2006-05-05"
                  + "&Notification.1.EventType=AssignmentSubmitted"
                  + "&Notification.2.Destination=ops%40example.com"
                  + "&Notification.2.Transport=Email"
                  + "&Notification.2.Version=2006-05-05"
                  + "&Notification.1.EventType=HITReviewable"
                  + "&Notification.2.EventType=HITExpired"
                  + "&Notification.3.EventType=AssignmentAbandoned");
    }

    @Test
    void singleEventAfterMultiEventNotificationKeepsItsOwnIndex() {
      ParameterBag params =
          ParameterBag.builder()
              .notifications(email("HITReviewable", "HITExpired"), email("AssignmentReturned"))
              .build();

      assertThat(StructuredField.NOTIFICATION.encode(params))
          .contains(
              "&Notification.1.EventType=HITReviewable&Notification.2.EventType=HITExpired"
                  + "&Notification.2.Destination=")
          .endsWith("&Notification.2.EventType=AssignmentReturned");
    }

    @Test
    void coercesEventTypeListFromGenericMap() {
      Map<String, Object> raw = new LinkedHashMap<>();
      raw.put("Destination", DESTINATION);
      raw.put("Transport", "Email");
      raw.put("Version", "2006-05-05");
      raw.put("EventType", List.of("HITReviewable", "HITExpired"));

      ParameterBag params = ParameterBag.of("Notification", List.of(raw));

      assertThat(params.getNotifications())
          .containsExactly(email("HITReviewable", "HITExpired"));
    }

    @Test
    void missingEventTypeIsMissingParameter() {
      Map<String, Object> raw =
          Map.of("Destination", DESTINATION, "Transport", "Email", "Version", "2006-05-05");

      assertThatThrownBy(() -> ParameterBag.of("Notification", List.of(raw)))
          .isInstanceOf(MturkMissingParameterException.class)
          .hasMessage("The Notification.1.EventType parameter is required.");
    }
  }

  @Test
  void encodeWithoutKeyThrowsMissingParameter() {
    for (StructuredField field : StructuredField.values()) {
      assertThatThrownBy(() -> field.encode(ParameterBag.empty()))
          .isInstanceOf(MturkMissingParameterException.class)
          .hasMessage("The " + field.key() + " parameter is required.");
    }
  }
}

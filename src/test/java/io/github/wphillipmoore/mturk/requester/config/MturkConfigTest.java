package io.github.wphillipmoore.mturk.requester.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.mturk.requester.request.ParameterBag;
import io.github.wphillipmoore.mturk.requester.request.QualificationRequirement;
import io.github.wphillipmoore.mturk.requester.request.QueryEncoding;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MturkConfigTest {

  @Nested
  class Defaults {

    @Test
    void endpointsDeriveFromDefaultRegion() {
      MturkConfig config = MturkConfig.defaults();

      assertThat(config.forMode(Mode.PRODUCTION).baseUrl())
          .isEqualTo("https://mturk-requester.us-east-1.amazonaws.com");
      assertThat(config.forMode(Mode.SANDBOX).baseUrl())
          .isEqualTo("https://mturk-requester-sandbox.us-east-1.amazonaws.com");
      assertThat(config.forMode(Mode.PRODUCTION).defaults().isEmpty()).isTrue();
    }

    @Test
    void forModeReportsMode() {
      MturkConfig config = MturkConfig.defaults();

      assertThat(config.forMode(Mode.PRODUCTION).mode()).isEqualTo(Mode.PRODUCTION);
      assertThat(config.forMode(Mode.SANDBOX).mode()).isEqualTo(Mode.SANDBOX);
    }

    @Test
    void nullModeThrows() {
      assertThatThrownBy(() -> MturkConfig.defaults().forMode(null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("mode");
    }
  }

  @Nested
  class Builder {

    @Test
    void sandboxKeepsProductionDefaultsItDoesNotOverride() {
      MturkConfig config =
          MturkConfig.builder()
              .productionDefaults(
                  ParameterBag.of("LifetimeInSeconds", 86400, "MaxAssignments", 3))
              .sandboxOverrides(ParameterBag.of("MaxAssignments", 1))
              .build();

      ParameterBag sandbox = config.forMode(Mode.SANDBOX).defaults();

      assertThat(sandbox.get("LifetimeInSeconds")).isEqualTo(86400);
      assertThat(sandbox.get("MaxAssignments")).isEqualTo(1);
      assertThat(config.forMode(Mode.PRODUCTION).defaults().get("MaxAssignments")).isEqualTo(3);
      assertThat(config.getSandboxOverrides()).isEqualTo(ParameterBag.of("MaxAssignments", 1));
    }

    @Test
    void regionsAndExplicitUrls() {
      MturkConfig config =
          MturkConfig.builder()
              .productionRegion("eu-west-1")
              .sandboxBaseUrl("http://localhost:8080/mturk")
              .build();

      assertThat(config.forMode(Mode.PRODUCTION).baseUrl())
          .isEqualTo("https://mturk-requester.eu-west-1.amazonaws.com");
      assertThat(config.forMode(Mode.PRODUCTION).region()).isEqualTo("eu-west-1");
      assertThat(config.forMode(Mode.SANDBOX).baseUrl()).isEqualTo("http://localhost:8080/mturk");
    }

    @Test
    void blankBaseUrlRejected() {
      assertThatThrownBy(() -> MturkConfig.builder().productionBaseUrl(" ").build())
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("baseUrl must not be blank");
    }
  }

  @Nested
  class LoadDefault {

    @Test
    void bundledResourceCarriesHitDefaults() {
      MturkConfig config = MturkConfig.loadDefault();

      ParameterBag production = config.forMode(Mode.PRODUCTION).defaults();
      assertThat(production.keys())
          .containsExactly(
              "AssignmentDurationInSeconds",
              "AutoApprovalDelayInSeconds",
              "LifetimeInSeconds",
              "MaxAssignments");
      assertThat(production.get("LifetimeInSeconds")).hasToString("86400");
    }

    @Test
    void bundledSandboxShortensLifetimeOnly() {
      MturkConfig config = MturkConfig.loadDefault();

      ParameterBag sandbox = config.forMode(Mode.SANDBOX).defaults();
      assertThat(sandbox.get("LifetimeInSeconds")).hasToString("3600");
      assertThat(sandbox.get("MaxAssignments")).hasToString("1");
      assertThat(config.forMode(Mode.SANDBOX).baseUrl())
          .isEqualTo("https://mturk-requester-sandbox.us-east-1.amazonaws.com");
    }

    @Test
    void missingResourceThrows() {
      assertThatThrownBy(() -> MturkConfig.loadFromResource("no-such-file.json"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessage("Configuration resource not found: no-such-file.json");
    }

    @Test
    void emptyResourceThrows() {
      assertThatThrownBy(() -> MturkConfig.loadFromResource("empty-config.json"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessage("Configuration resource unreadable: empty-config.json");
    }

    @Test
    void unreadableResourceThrows() {
      assertThatThrownBy(() -> MturkConfig.loadFromResource("broken-config.json"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessage("Configuration resource unreadable: broken-config.json");
    }
  }

  @Nested
  class FromJson {

    @Test
    void parsesSectionsAndStructuredDefaults() {
      MturkConfig config =
          MturkConfig.fromJson(
              "{\"production\": {\"region\": \"us-west-2\", \"defaults\": {"
                  + "\"MaxAssignments\": 5,"
                  + "\"QualificationRequirement\": [{\"QualificationTypeId\": \"000\","
                  + " \"Comparator\": \"GreaterThan\", \"IntegerValue\": 90}]}},"
                  + " \"sandbox\": {\"baseUrl\": \"http://localhost:9000\"}}");

      EndpointConfig production = config.forMode(Mode.PRODUCTION);
      assertThat(production.baseUrl()).isEqualTo("https://mturk-requester.us-west-2.amazonaws.com");
      assertThat(production.defaults().getQualificationRequirements())
          .containsExactly(QualificationRequirement.ofInteger("000", "GreaterThan", 90));
      assertThat(config.forMode(Mode.SANDBOX).baseUrl()).isEqualTo("http://localhost:9000");
      assertThat(config.forMode(Mode.SANDBOX).defaults().get("MaxAssignments")).hasToString("5");
    }

    @Test
    void numbersKeepTheirWrittenForm() {
      MturkConfig config =
          MturkConfig.fromJson(
              "{\"production\": {\"defaults\": {"
                  + "\"UniqueRequestToken\": 9007199254740993, \"MaxAssignments\": 3}}}");

      ParameterBag defaults = config.forMode(Mode.PRODUCTION).defaults();
      assertThat(QueryEncoding.render(defaults.get("UniqueRequestToken")))
          .isEqualTo("9007199254740993");
      assertThat(QueryEncoding.render(defaults.get("MaxAssignments"))).isEqualTo("3");
    }

    @Test
    void lossyQualificationValuesRejected() {
      assertThatThrownBy(
              () ->
                  MturkConfig.fromJson(
                      "{\"production\": {\"defaults\": {\"QualificationRequirement\": ["
                          + "{\"QualificationTypeId\": \"000\", \"Comparator\": \"In\","
                          + " \"IntegerValue\": 2.5, \"RequiredToPreview\": 1}]}}}"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageStartingWith("QualificationRequirement.1.IntegerValue must be an integer");
    }

    @Test
    void emptyObjectGivesDefaults() {
      MturkConfig config = MturkConfig.fromJson("{}");

      assertThat(config.forMode(Mode.PRODUCTION).baseUrl())
          .isEqualTo(MturkConfig.defaults().forMode(Mode.PRODUCTION).baseUrl());
    }

    @Test
    void emptyStringRejected() {
      assertThatThrownBy(() -> MturkConfig.fromJson(""))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("json must not be empty");
    }

    @Test
    void invalidJsonRejected() {
      assertThatThrownBy(() -> MturkConfig.fromJson("{not json"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Invalid JSON configuration");
    }

    @Test
    void unknownSectionRejected() {
      assertThatThrownBy(() -> MturkConfig.fromJson("{\"staging\": {}}"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Unknown configuration section: staging");
    }

    @Test
    void unknownSectionKeyRejected() {
      assertThatThrownBy(() -> MturkConfig.fromJson("{\"sandbox\": {\"endpoint\": \"x\"}}"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Unknown key in sandbox: endpoint");
    }

    @Test
    void nonObjectDefaultsRejected() {
      assertThatThrownBy(() -> MturkConfig.fromJson("{\"production\": {\"defaults\": [1]}}"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("defaults must be an object");
    }

    @Test
    void nonStringRegionRejected() {
      assertThatThrownBy(() -> MturkConfig.fromJson("{\"production\": {\"region\": 1}}"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("region must be a string");
    }
  }
}

package io.github.wphillipmoore.mturk.requester.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MturkServiceExceptionTest {

  @Test
  void requestExceptionKeepsMessageErrorsAndStatus() {
    Map<String, Object> errors = Map.of("Error", Map.of("Code", "AWS.X", "Message", "bad"));
    MturkRequestException ex = new MturkRequestException("fail", errors, 400);
    assertThat(ex.getMessage()).isEqualTo("fail");
    assertThat(ex.getErrors()).isEqualTo(errors);
    assertThat(ex.getStatusCode()).isEqualTo(400);
    assertThat(ex).isInstanceOf(MturkServiceException.class).isInstanceOf(MturkException.class);
  }

  @Test
  void nullStatusCodeAccepted() {
    MturkNotAuthorizedException ex = new MturkNotAuthorizedException("fail", Map.of(), null);
    assertThat(ex.getStatusCode()).isNull();
  }

  @Test
  void nullErrorsThrows() {
    assertThatThrownBy(() -> new MturkRequestException("fail", null, 400))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("errors");
  }

  @Test
  void errorsAreDefensivelyCopied() {
    Map<String, Object> errors = new HashMap<>();
    errors.put("Error", Map.of("Code", "AWS.X"));
    MturkRequestException ex = new MturkRequestException("fail", errors, 400);
    errors.clear();
    assertThat(ex.getErrors()).containsOnlyKeys("Error");
    assertThatThrownBy(() -> ex.getErrors().put("Other", "x"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void serviceErrorsFromSingleError() {
    MturkRequestException ex =
        new MturkRequestException(
            "fail", Map.of("Error", Map.of("Code", "AWS.X", "Message", "bad")), 200);
    assertThat(ex.getServiceErrors()).containsExactly(new ServiceError("AWS.X", "bad"));
  }

  @Test
  void serviceErrorsFromErrorList() {
    Map<String, Object> errors =
        Map.of(
            "Error",
            List.of(Map.of("Code", "AWS.A", "Message", "first"), Map.of("Code", "AWS.B")));
    MturkRequestException ex = new MturkRequestException("fail", errors, 200);
    assertThat(ex.getServiceErrors())
        .containsExactly(new ServiceError("AWS.A", "first"), new ServiceError("AWS.B", ""));
  }

  @Test
  void serviceErrorsEmptyWhenErrorIsNotRecord() {
    MturkRequestException ex = new MturkRequestException("fail", Map.of("Error", "text"), 200);
    assertThat(ex.getServiceErrors()).isEmpty();
  }
}

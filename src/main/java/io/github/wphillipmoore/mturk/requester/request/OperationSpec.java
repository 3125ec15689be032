package io.github.wphillipmoore.mturk.requester.request;

import java.util.List;
import java.util.Objects;

/**
 * Declares how one service operation is requested and answered.
 *
 * @param name the wire operation name, e.g. {@code CreateHIT}
 * @param requiredKeys scalar parameters that must be present, in emission order
 * @param optionalKeys scalar parameters emitted when present, in emission order
 * @param structuredFields structured parameters appended after the scalars, in emission order
 * @param resultKey the response element holding the operation's result
 */
public record OperationSpec(
    String name,
    List<String> requiredKeys,
    List<String> optionalKeys,
    List<StructuredField> structuredFields,
    String resultKey) {

  /** Validates fields and copies the lists. */
  public OperationSpec {
    Objects.requireNonNull(name, "name");
    requiredKeys = List.copyOf(Objects.requireNonNull(requiredKeys, "requiredKeys"));
    optionalKeys = List.copyOf(Objects.requireNonNull(optionalKeys, "optionalKeys"));
    structuredFields = List.copyOf(Objects.requireNonNull(structuredFields, "structuredFields"));
    Objects.requireNonNull(resultKey, "resultKey");
  }

  /** Declares an operation without structured parameters. */
  public OperationSpec(
      String name, List<String> requiredKeys, List<String> optionalKeys, String resultKey) {
    this(name, requiredKeys, optionalKeys, List.of(), resultKey);
  }

  /** Declares an operation whose result element is {@code <name>Result}. */
  public static OperationSpec of(String name, List<String> requiredKeys, List<String> optionalKeys) {
    return new OperationSpec(name, requiredKeys, optionalKeys, name + "Result");
  }
}

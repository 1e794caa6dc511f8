package ca.gc.cra.recstream.application.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.recstream.application.port.HostFunctionResolver;
import ca.gc.cra.recstream.domain.function.HostFunction;
import ca.gc.cra.recstream.domain.function.RegistryToken;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RecordExpressionTest {
  private final Record record = new Record()
      .put("name", "alpha")
      .put("count", 3L)
      .put("ratio", 0.5d)
      .put("nested", Map.of("inner", List.of("x", "y")))
      .put("flag", Boolean.TRUE)
      .put("empty", null);

  private boolean test(String expression) {
    return RecordExpression.compile(expression).test(record, HostFunctionResolver.NONE);
  }

  @Test
  void comparesNumbersAcrossIntegralAndFloatingTypes() {
    assertTrue(test("$.count == 3"));
    assertTrue(test("$.count == 3.0"));
    assertTrue(test("$.count > 2"));
    assertTrue(test("$.count >= 3"));
    assertTrue(test("$.ratio < 1"));
    assertTrue(test("$.ratio <= 0.5"));
    assertFalse(test("$.count != 3"));
    assertTrue(test("$.count > -1"));
  }

  @Test
  void comparesStringsAndLiterals() {
    assertTrue(test("$.name == 'alpha'"));
    assertTrue(test("$.name == \"alpha\""));
    assertTrue(test("$.name < 'beta'"));
    assertTrue(test("$.flag == true"));
    assertTrue(test("$.empty == null"));
    assertTrue(test("$.missing == null"));
  }

  @Test
  void orderingAgainstMissingFieldsIsFalse() {
    assertFalse(test("$.missing > 1"));
    assertFalse(test("$.missing < 1"));
  }

  @Test
  void regexMatchFindsSubstrings() {
    assertTrue(test("$.name =~ 'lph'"));
    assertTrue(test("$.name =~ '^a.*a$'"));
    assertFalse(test("$.name =~ '^b'"));
    assertFalse(test("$.missing =~ 'a'"));
  }

  @Test
  void readsNestedPathsAndIndexes() {
    RecordExpression expression = RecordExpression.compile("$.nested.inner[1]");

    assertEquals("y", expression.evaluate(record, HostFunctionResolver.NONE));
    assertTrue(test("$['nested']['inner'][0] == 'x'"));
    assertNull(RecordExpression.compile("$.nested.inner[5]").evaluate(record, HostFunctionResolver.NONE));
  }

  @Test
  void bareOperandUsesTruthiness() {
    assertTrue(test("$.flag"));
    assertTrue(test("$.count"));
    assertFalse(test("$.empty"));
    assertFalse(test("$.missing"));
    assertSame(record, RecordExpression.compile("$r").evaluate(record, HostFunctionResolver.NONE));
  }

  @Test
  void commentLinesAreIgnored() {
    assertTrue(test("# keep counts above two\n$.count > 2"));
  }

  @Test
  void onlyLeadingCommentBlockIsStripped() {
    Record multiLine = new Record().put("note", "first\n  second").put("tag", "#x");

    assertTrue(RecordExpression.compile("# note check\n$.note == 'first\n  second'")
        .test(multiLine, HostFunctionResolver.NONE));
    assertTrue(RecordExpression.compile("$.tag ==\n'#x'").test(multiLine, HostFunctionResolver.NONE));
  }

  @Test
  void hostInvocationCallsResolvedFunction() {
    RegistryToken token = new RegistryToken("hf-1-1");
    HostFunction fn = r -> r.get("count");
    HostFunctionResolver resolver = t -> t.equals(token) ? Optional.of(fn) : Optional.empty();

    RecordExpression expression = RecordExpression.compile(RecordExpression.hostInvocation(token) + " == 3");

    assertTrue(expression.test(record, resolver));
  }

  @Test
  void hostFunctionCanMutateRecord() {
    RegistryToken token = new RegistryToken("hf-9-1");
    HostFunction fn = r -> r.put("touched", true);
    HostFunctionResolver resolver = t -> Optional.of(fn);

    RecordExpression.compile(RecordExpression.hostInvocation(token)).evaluate(record, resolver);

    assertEquals(Boolean.TRUE, record.get("touched"));
  }

  @Test
  void unknownTokenFailsAtEvaluation() {
    RecordExpression expression = RecordExpression.compile("host('hf-0-0', $r)");

    assertThrows(ExpressionException.class, () -> expression.evaluate(record, HostFunctionResolver.NONE));
  }

  @Test
  void malformedExpressionsFailToCompile() {
    assertThrows(ExpressionException.class, () -> RecordExpression.compile(""));
    assertThrows(ExpressionException.class, () -> RecordExpression.compile("# only a comment"));
    assertThrows(ExpressionException.class, () -> RecordExpression.compile("$.a =="));
    assertThrows(ExpressionException.class, () -> RecordExpression.compile("$.a == 1 2"));
    assertThrows(ExpressionException.class, () -> RecordExpression.compile("'unterminated"));
    assertThrows(ExpressionException.class, () -> RecordExpression.compile("bogus"));
    assertThrows(ExpressionException.class, () -> RecordExpression.compile("$.a =~ '['"));
    assertThrows(ExpressionException.class, () -> RecordExpression.compile("host('bad token', $r)"));
  }

  @Test
  void truthinessFollowsValueKind() {
    assertFalse(RecordExpression.isTruthy(null));
    assertFalse(RecordExpression.isTruthy(0L));
    assertFalse(RecordExpression.isTruthy(""));
    assertFalse(RecordExpression.isTruthy(List.of()));
    assertFalse(RecordExpression.isTruthy(Map.of()));
    assertTrue(RecordExpression.isTruthy("0"));
    assertTrue(RecordExpression.isTruthy(new Record()));
  }
}

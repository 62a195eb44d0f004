package com.evoila.argus.common.query.operator;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Comparison operators accepted in filters.
 *
 * <p>Each operator carries the symbol clients send, the SQL token used for direct substitution, its
 * negation and whether it applies to array columns.
 */
@Getter
public enum OperatorKind {
  EQ("eq", "=", false),
  NE("ne", "!=", false),
  GT("gt", ">", false),
  GTE("gte", ">=", false),
  LT("lt", "<", false),
  LTE("lte", "<=", false),
  CONTAINS("contains", "ILIKE", false),
  NOT_CONTAINS("not_contains", "NOT ILIKE", false),
  HAS("has", "has", true),
  NOT_HAS("not_has", "NOT has", true);

  // Spellings used by older clients and saved trigger configurations
  private static final Map<String, OperatorKind> ALIASES =
      Map.of(
          "neq", NE,
          "ilike", CONTAINS,
          "not_ilike", NOT_CONTAINS,
          "ne_has", NOT_HAS);

  /** -- GETTER -- Symbol used in serialized filters */
  private final String symbol;

  /** -- GETTER -- SQL token for direct substitution */
  private final String sqlToken;

  /** -- GETTER -- Whether the operator checks membership in an array column */
  private final boolean arrayOperator;

  OperatorKind(String symbol, String sqlToken, boolean arrayOperator) {
    this.symbol = symbol;
    this.sqlToken = sqlToken;
    this.arrayOperator = arrayOperator;
  }

  /**
   * Parses an operator symbol (case-insensitive, aliases included).
   *
   * @param symbol The symbol from a serialized filter
   * @return The operator, or empty when the symbol is not recognized
   */
  public static Optional<OperatorKind> fromSymbol(String symbol) {
    if (symbol == null) {
      return Optional.empty();
    }
    String normalized = symbol.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(op -> op.symbol.equals(normalized))
        .findFirst()
        .or(() -> Optional.ofNullable(ALIASES.get(normalized)));
  }

  /** The operator that selects exactly the rows this one rejects. */
  public OperatorKind negate() {
    return switch (this) {
      case EQ -> NE;
      case NE -> EQ;
      case GT -> LTE;
      case GTE -> LT;
      case LT -> GTE;
      case LTE -> GT;
      case CONTAINS -> NOT_CONTAINS;
      case NOT_CONTAINS -> CONTAINS;
      case HAS -> NOT_HAS;
      case NOT_HAS -> HAS;
    };
  }

  /** Whether this operator is the negated member of its pair (ne, not_contains, not_has). */
  public boolean isNegative() {
    return this == NE || this == NOT_CONTAINS || this == NOT_HAS;
  }

  /** Whether this operator orders values (gt, gte, lt, lte). */
  public boolean isOrdering() {
    return this == GT || this == GTE || this == LT || this == LTE;
  }

  @Override
  public String toString() {
    return symbol;
  }
}

package daddy.model.hom;

/**
 * How a weighted sum is compared against zero.
 */
public enum Comparator {
	EQ("=="),
	NE("!="),
	LT("<"),
	LE("<="),
	GT(">"),
	GE(">=");

	private final String symbol;

	Comparator(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}

	public static Comparator fromSymbol(String symbol) {
		for (Comparator comparator : values()) {
			if (comparator.symbol.equals(symbol)) {
				return comparator;
			}
		}
		throw new IllegalArgumentException("no comparison '" + symbol + "'");
	}

	public boolean test(int value) {
		switch (this) {
			case EQ:
				return value == 0;
			case NE:
				return value != 0;
			case LT:
				return value < 0;
			case LE:
				return value <= 0;
			case GT:
				return value > 0;
			case GE:
				return value >= 0;
			default:
				throw new IllegalStateException(name());
		}
	}

	public Comparator negate() {
		switch (this) {
			case EQ:
				return NE;
			case NE:
				return EQ;
			case LT:
				return GE;
			case LE:
				return GT;
			case GT:
				return LE;
			case GE:
				return LT;
			default:
				throw new IllegalStateException(name());
		}
	}
}

package daddy.model.hom;

import daddy.formatters.HomFormattingVisitor;
import daddy.model.ddd.Diagram;

/**
 * A path rewriting function. Homomorphisms are plain immutable data; {@link HomEvaluator} gives them their meaning,
 * so applying one never changes it and equal homomorphisms always give equal results.
 */
public abstract class Hom {

	public abstract <T, E extends Throwable> T accept(HomVisitor<T, E> v) throws E;

	public Diagram apply(Diagram diagram) {
		return HomEvaluator.apply(this, diagram);
	}

	/**
	 * @return the homomorphism applying {@code inner} first, then this one
	 */
	public Hom compose(Hom inner) {
		if (this instanceof IdentityHom) {
			return inner;
		}
		if (inner instanceof IdentityHom) {
			return this;
		}
		return new ComposeHom(this, inner);
	}

	@Override
	public String toString() {
		return accept(new HomFormattingVisitor());
	}

}

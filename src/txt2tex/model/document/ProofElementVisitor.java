package txt2tex.model.document;

public abstract class ProofElementVisitor<T, E extends Throwable> {
	public abstract T visit(ProofNode proofNode) throws E;
	public abstract T visit(ProofCase proofCase) throws E;
}

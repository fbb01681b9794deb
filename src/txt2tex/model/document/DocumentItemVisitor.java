package txt2tex.model.document;

public abstract class DocumentItemVisitor<T, E extends Throwable> {
	public abstract T visit(Section section) throws E;
	public abstract T visit(Solution solution) throws E;
	public abstract T visit(Part part) throws E;
	public abstract T visit(Paragraph paragraph) throws E;
	public abstract T visit(PageBreak pageBreak) throws E;
	public abstract T visit(TruthTable truthTable) throws E;
	public abstract T visit(EquivChain equivChain) throws E;
	public abstract T visit(ProofTree proofTree) throws E;
	public abstract T visit(InferenceRule inferenceRule) throws E;
	public abstract T visit(ZedBlock zedBlock) throws E;
	public abstract T visit(ZParagraphItem zParagraphItem) throws E;
	public abstract T visit(ExpressionItem expressionItem) throws E;
}

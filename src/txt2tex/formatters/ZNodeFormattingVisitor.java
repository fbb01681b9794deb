package txt2tex.formatters;

import txt2tex.model.z.*;

import java.io.IOException;
import java.util.Collections;

public class ZNodeFormattingVisitor extends ZNodeVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final ZExpressionFormattingVisitor expressions;
	private final ZParagraphFormattingVisitor paragraphs;

	public ZNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
		this.expressions = new ZExpressionFormattingVisitor(out);
		this.paragraphs = new ZParagraphFormattingVisitor(out);
	}

	@Override
	public Void visit(ZExpression expression) throws IOException {
		return expression.accept(expressions);
	}

	@Override
	public Void visit(ZParagraph paragraph) throws IOException {
		return paragraph.accept(paragraphs);
	}

	@Override
	public Void visit(ZBinding binding) throws IOException {
		expressions.writeBindings(Collections.singletonList(binding));
		return null;
	}

	@Override
	public Void visit(ZDeclarationItem declarationItem) throws IOException {
		paragraphs.writeDeclarationItem(declarationItem);
		return null;
	}

	@Override
	public Void visit(ZFreeTypeBranch branch) throws IOException {
		paragraphs.writeBranch(branch);
		return null;
	}
}

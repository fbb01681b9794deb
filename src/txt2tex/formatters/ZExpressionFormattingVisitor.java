package txt2tex.formatters;

import txt2tex.model.z.*;

import java.io.IOException;
import java.util.List;

/**
 * Writes an expression in a canonical ASCII form. Every operator application is parenthesised, so the text
 * shows exactly how the parser grouped the input.
 */
public class ZExpressionFormattingVisitor extends ZExpressionVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ZExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeList(String sep, List<ZExpression> expressions) throws IOException {
		FormattingTools.writeSeparated(out, sep, expressions, e -> e.accept(this));
	}

	void writeBindings(List<ZBinding> bindings) throws IOException {
		FormattingTools.writeSeparated(out, "; ", bindings, b -> {
			if(b.isTuplePattern()) {
				out.write("(");
			}
			FormattingTools.writeSeparated(out, ", ", b.getNames(), n -> n.accept(this));
			if(b.isTuplePattern()) {
				out.write(")");
			}
			if(b.getDomain() != null) {
				out.write(" : ");
				b.getDomain().accept(this);
			}
		});
	}

	private void writeBinder(String keyword, ZBinder binder) throws IOException {
		out.write("(");
		out.write(keyword);
		out.write(" ");
		writeBindings(binder.getBindings());
		if(binder.getConstraint() != null) {
			out.write(" | ");
			binder.getConstraint().accept(this);
		}
		if(binder.getBody() != null) {
			out.write(binder.getConstraint() == null && !(binder instanceof ZLambda) ? " | " : " . ");
			binder.getBody().accept(this);
		}
		out.write(")");
	}

	@Override
	public Void visit(ZIdentifier zIdentifier) throws IOException {
		out.write(zIdentifier.getName());
		return null;
	}

	@Override
	public Void visit(ZNumber zNumber) throws IOException {
		out.write(zNumber.getValue());
		return null;
	}

	@Override
	public Void visit(ZConstant zConstant) throws IOException {
		switch(zConstant.getKind()) {
			case TRUE:
				out.write("true");
				break;
			case FALSE:
				out.write("false");
				break;
			case EMPTYSET:
				out.write("emptyset");
				break;
		}
		return null;
	}

	@Override
	public Void visit(ZRawText zRawText) throws IOException {
		out.write(zRawText.getText());
		return null;
	}

	@Override
	public Void visit(ZBinOp zBinOp) throws IOException {
		out.write("(");
		zBinOp.getLHS().accept(this);
		out.write(" ");
		out.write(zBinOp.getOperation().getSpelling());
		out.write(" ");
		zBinOp.getRHS().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZUnaryOp zUnaryOp) throws IOException {
		String op = zUnaryOp.getOperation().getSpelling();
		out.write("(");
		if(zUnaryOp.isPostfix()) {
			zUnaryOp.getOperand().accept(this);
			out.write(op);
		} else {
			out.write(op);
			if(Character.isLetter(op.charAt(0))) {
				out.write(" ");
			}
			zUnaryOp.getOperand().accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZComparisonChain zComparisonChain) throws IOException {
		out.write("(");
		List<ZExpression> operands = zComparisonChain.getOperands();
		operands.get(0).accept(this);
		for(int i = 0; i < zComparisonChain.getOperators().size(); ++i) {
			out.write(" ");
			out.write(zComparisonChain.getOperators().get(i).getSpelling());
			out.write(" ");
			operands.get(i + 1).accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZSubscript zSubscript) throws IOException {
		zSubscript.getBase().accept(this);
		out.write("_{");
		zSubscript.getSubscript().accept(this);
		out.write("}");
		return null;
	}

	@Override
	public Void visit(ZSuperscript zSuperscript) throws IOException {
		zSuperscript.getBase().accept(this);
		out.write("^{");
		zSuperscript.getExponent().accept(this);
		out.write("}");
		return null;
	}

	@Override
	public Void visit(ZQuantified zQuantified) throws IOException {
		writeBinder(zQuantified.getKind().name().toLowerCase(), zQuantified);
		return null;
	}

	@Override
	public Void visit(ZLambda zLambda) throws IOException {
		writeBinder("lambda", zLambda);
		return null;
	}

	@Override
	public Void visit(ZDefiniteDescription zDefiniteDescription) throws IOException {
		out.write("(mu ");
		writeBindings(zDefiniteDescription.getBindings());
		if(zDefiniteDescription.getConstraint() != null) {
			out.write(" | ");
			zDefiniteDescription.getConstraint().accept(this);
		}
		if(zDefiniteDescription.getBody() != null) {
			out.write(" . ");
			zDefiniteDescription.getBody().accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZSetLiteral zSetLiteral) throws IOException {
		out.write("{");
		writeList(", ", zSetLiteral.getElements());
		out.write("}");
		return null;
	}

	@Override
	public Void visit(ZSetComprehension zSetComprehension) throws IOException {
		out.write("{");
		writeBindings(zSetComprehension.getBindings());
		if(zSetComprehension.getConstraint() != null) {
			out.write(" | ");
			zSetComprehension.getConstraint().accept(this);
		}
		if(zSetComprehension.getSelector() != null) {
			out.write(" . ");
			zSetComprehension.getSelector().accept(this);
		}
		out.write("}");
		return null;
	}

	@Override
	public Void visit(ZSequenceLiteral zSequenceLiteral) throws IOException {
		out.write("<");
		writeList(", ", zSequenceLiteral.getElements());
		out.write(">");
		return null;
	}

	@Override
	public Void visit(ZBagLiteral zBagLiteral) throws IOException {
		out.write("[[");
		writeList(", ", zBagLiteral.getElements());
		out.write("]]");
		return null;
	}

	@Override
	public Void visit(ZTuple zTuple) throws IOException {
		out.write("(");
		writeList(", ", zTuple.getElements());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZApplication zApplication) throws IOException {
		zApplication.getFunction().accept(this);
		out.write("(");
		writeList(", ", zApplication.getArguments());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZRelationalImage zRelationalImage) throws IOException {
		zRelationalImage.getRelation().accept(this);
		out.write("(| ");
		zRelationalImage.getSet().accept(this);
		out.write(" |)");
		return null;
	}

	@Override
	public Void visit(ZInstantiation zInstantiation) throws IOException {
		zInstantiation.getBase().accept(this);
		out.write("[");
		writeList(", ", zInstantiation.getArguments());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(ZProjection zProjection) throws IOException {
		zProjection.getBase().accept(this);
		out.write(".");
		out.write(zProjection.getField());
		return null;
	}

	@Override
	public Void visit(ZConditional zConditional) throws IOException {
		out.write("(if ");
		zConditional.getCondition().accept(this);
		out.write(" then ");
		zConditional.getThen().accept(this);
		out.write(" else ");
		zConditional.getElse().accept(this);
		out.write(")");
		return null;
	}
}

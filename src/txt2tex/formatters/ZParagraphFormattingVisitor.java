package txt2tex.formatters;

import txt2tex.model.z.*;

import java.io.IOException;
import java.util.List;

/**
 * Writes Z paragraphs back in the plain-text block syntax they are read from.
 */
public class ZParagraphFormattingVisitor extends ZParagraphVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final ZExpressionFormattingVisitor expressions;

	public ZParagraphFormattingVisitor(IndentingWriter out) {
		this.out = out;
		this.expressions = new ZExpressionFormattingVisitor(out);
	}

	private void writeGenericParameters(List<ZIdentifier> parameters) throws IOException {
		if(parameters.isEmpty()) {
			return;
		}
		out.write("[");
		FormattingTools.writeSeparated(out, ", ", parameters, p -> p.accept(expressions));
		out.write("]");
	}

	void writeDeclarationItem(ZDeclarationItem item) throws IOException {
		if(item instanceof ZDeclaration) {
			ZDeclaration declaration = (ZDeclaration) item;
			declaration.getName().accept(expressions);
			out.write(" : ");
			declaration.getType().accept(expressions);
		} else {
			ZSchemaInclusion inclusion = (ZSchemaInclusion) item;
			switch(inclusion.getDecoration()) {
				case DELTA:
					out.write("Delta ");
					break;
				case XI:
					out.write("Xi ");
					break;
				default:
					break;
			}
			inclusion.getSchema().accept(expressions);
			if(!inclusion.getArguments().isEmpty()) {
				out.write("[");
				FormattingTools.writeSeparated(out, ", ", inclusion.getArguments(), a -> a.accept(expressions));
				out.write("]");
			}
		}
	}

	void writeBranch(ZFreeTypeBranch branch) throws IOException {
		branch.getConstructor().accept(expressions);
		if(branch.getArgument() != null) {
			out.write("<");
			branch.getArgument().accept(expressions);
			out.write(">");
		}
	}

	private void writeBlock(String keyword, ZIdentifier name, ZBlock block) throws IOException {
		out.write(keyword);
		if(name != null) {
			out.write(" ");
			name.accept(expressions);
			writeGenericParameters(block.getGenericParameters());
		} else if(!block.getGenericParameters().isEmpty()) {
			out.write(" ");
			writeGenericParameters(block.getGenericParameters());
		}
		try(IndentingWriter.Indent i_ = out.indent()) {
			for(ZDeclarationItem item : block.getDeclarations()) {
				out.newLine();
				writeDeclarationItem(item);
			}
		}
		if(!block.getPredicates().isEmpty()) {
			out.newLine();
			out.write("where");
			try(IndentingWriter.Indent i_ = out.indent()) {
				for(ZExpression predicate : block.getPredicates()) {
					out.newLine();
					predicate.accept(expressions);
				}
			}
		}
		out.newLine();
		out.write("end");
	}

	@Override
	public Void visit(ZGivenType zGivenType) throws IOException {
		out.write("given ");
		FormattingTools.writeSeparated(out, ", ", zGivenType.getNames(), n -> n.accept(expressions));
		return null;
	}

	@Override
	public Void visit(ZFreeType zFreeType) throws IOException {
		zFreeType.getName().accept(expressions);
		out.write(" ::= ");
		FormattingTools.writeSeparated(out, " | ", zFreeType.getBranches(), this::writeBranch);
		return null;
	}

	@Override
	public Void visit(ZAbbreviation zAbbreviation) throws IOException {
		if(!zAbbreviation.getGenericParameters().isEmpty()) {
			writeGenericParameters(zAbbreviation.getGenericParameters());
			out.write(" ");
		}
		zAbbreviation.getName().accept(expressions);
		out.write(" == ");
		zAbbreviation.getDefinition().accept(expressions);
		return null;
	}

	@Override
	public Void visit(ZAxiomaticDefinition zAxiomaticDefinition) throws IOException {
		writeBlock("axdef", null, zAxiomaticDefinition);
		return null;
	}

	@Override
	public Void visit(ZGenericDefinition zGenericDefinition) throws IOException {
		writeBlock("gendef", null, zGenericDefinition);
		return null;
	}

	@Override
	public Void visit(ZSchema zSchema) throws IOException {
		writeBlock("schema", zSchema.getName(), zSchema);
		return null;
	}
}

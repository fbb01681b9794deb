package txt2tex.formatters;

import txt2tex.model.document.*;
import txt2tex.model.z.ZExpression;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Writes an indented outline of a document, one item per line, with expressions in their canonical form.
 * Meant for debugging and for comparing parse results in tests.
 */
public class DocumentFormattingVisitor extends DocumentItemVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final ZNodeFormattingVisitor z;

	public DocumentFormattingVisitor(IndentingWriter out) {
		this.out = out;
		this.z = new ZNodeFormattingVisitor(out);
	}

	public void writeDocument(Document document) throws IOException {
		out.write("document");
		try(IndentingWriter.Indent i_ = out.indent()) {
			for(Map.Entry<String, String> entry : document.getMetadata().entrySet()) {
				out.newLine();
				out.write(entry.getKey() + ": " + entry.getValue());
			}
			writeItems(document.getItems());
		}
	}

	private void writeItems(List<DocumentItem> items) throws IOException {
		for(DocumentItem item : items) {
			out.newLine();
			item.accept(this);
		}
	}

	private void writeContainer(String kind, Container container) throws IOException {
		out.write(kind + " " + container.getTitle());
		try(IndentingWriter.Indent i_ = out.indent()) {
			writeItems(container.getItems());
		}
	}

	@Override
	public Void visit(Section section) throws IOException {
		writeContainer("section", section);
		return null;
	}

	@Override
	public Void visit(Solution solution) throws IOException {
		writeContainer("solution", solution);
		return null;
	}

	@Override
	public Void visit(Part part) throws IOException {
		writeContainer("part", part);
		return null;
	}

	@Override
	public Void visit(Paragraph paragraph) throws IOException {
		out.write(paragraph.getKind().name().toLowerCase() + " " + paragraph.getText());
		try(IndentingWriter.Indent i_ = out.indent()) {
			for(ProseSpan span : paragraph.getSpans()) {
				out.newLine();
				out.write("span " + span.getStart() + "-" + span.getEnd() + " ");
				span.getExpression().accept(z);
			}
		}
		return null;
	}

	@Override
	public Void visit(PageBreak pageBreak) throws IOException {
		out.write("pagebreak");
		return null;
	}

	@Override
	public Void visit(TruthTable truthTable) throws IOException {
		out.write("truth table ");
		FormattingTools.writeSeparated(out, " | ", truthTable.getHeaders(), h -> h.accept(z));
		try(IndentingWriter.Indent i_ = out.indent()) {
			for(List<Boolean> row : truthTable.getRows()) {
				out.newLine();
				FormattingTools.writeSeparated(out, " | ", row, v -> out.write(v ? "T" : "F"));
			}
		}
		return null;
	}

	@Override
	public Void visit(EquivChain equivChain) throws IOException {
		out.write(equivChain.getKind().name().toLowerCase());
		try(IndentingWriter.Indent i_ = out.indent()) {
			for(EquivStep step : equivChain.getSteps()) {
				out.newLine();
				out.write(step.toString());
			}
		}
		return null;
	}

	private void writeProofElement(ProofElement element) throws IOException {
		element.accept(new ProofElementVisitor<Void, IOException>() {
			@Override
			public Void visit(ProofNode proofNode) throws IOException {
				if(proofNode.getLabel() != null) {
					out.write("[" + proofNode.getLabel() + "] ");
				}
				if(proofNode.isSibling()) {
					out.write(":: ");
				}
				proofNode.getExpression().accept(z);
				if(proofNode.getJustification() != null) {
					out.write(" [" + proofNode.getJustification() + "]");
				}
				return null;
			}

			@Override
			public Void visit(ProofCase proofCase) throws IOException {
				out.write("case " + proofCase.getName() + ":");
				return null;
			}
		});
		try(IndentingWriter.Indent i_ = out.indent()) {
			for(ProofElement child : element.getChildren()) {
				out.newLine();
				writeProofElement(child);
			}
		}
	}

	@Override
	public Void visit(ProofTree proofTree) throws IOException {
		out.write("proof");
		try(IndentingWriter.Indent i_ = out.indent()) {
			out.newLine();
			writeProofElement(proofTree.getConclusion());
		}
		return null;
	}

	@Override
	public Void visit(InferenceRule inferenceRule) throws IOException {
		out.write("infrule");
		try(IndentingWriter.Indent i_ = out.indent()) {
			for(InferenceLine premise : inferenceRule.getPremises()) {
				out.newLine();
				out.write(premise.toString());
			}
			out.newLine();
			out.write("---");
			out.newLine();
			out.write(inferenceRule.getConclusion().toString());
		}
		return null;
	}

	@Override
	public Void visit(ZedBlock zedBlock) throws IOException {
		out.write("zed");
		try(IndentingWriter.Indent i_ = out.indent()) {
			writeItems(zedBlock.getItems());
		}
		out.newLine();
		out.write("end");
		return null;
	}

	@Override
	public Void visit(ZParagraphItem zParagraphItem) throws IOException {
		zParagraphItem.getParagraph().accept(z);
		return null;
	}

	@Override
	public Void visit(ExpressionItem expressionItem) throws IOException {
		ZExpression expression = expressionItem.getExpression();
		expression.accept(z);
		return null;
	}
}

package txt2tex.util;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A span of source text. Lines and columns are 1-based, offsets are 0-based character offsets into the
 * buffer being read, with the end offset exclusive. The file may be null for text that did not come from disk.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public String prettyString() {
		if(isUnknown()) {
			return "at unknown source location";
		}
		StringBuilder sb = new StringBuilder("at ");
		if(startLine != endLine) {
			sb.append(startLine).append(':').append(startColumn).append('-').append(endLine).append(':').append(endColumn);
		} else if(endColumn - startColumn > 1) {
			sb.append(startLine).append(':').append(startColumn).append('-').append(endColumn - 1);
		} else {
			sb.append(startLine).append(':').append(startColumn);
		}
		if(file != null) {
			sb.append(" in file ").append(file);
		}
		return sb.toString();
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return startOffset < 0;
	}

	/**
	 * @return true if other lies entirely within this span
	 */
	public boolean encloses(SourceLocation other) {
		if(isUnknown() || other.isUnknown()) {
			return false;
		}
		return startOffset <= other.startOffset && other.endOffset <= endOffset;
	}

	public SourceLocation combine(SourceLocation other) {
		if(isUnknown()) {
			return other;
		}else if(other.isUnknown()) {
			return this;
		}
		// combining spans from two buffers is a programming error in the parser
		if(!Objects.equals(file, other.getFile())) {
			throw new IllegalArgumentException("Tried to combine source locations from two different files: " + file + ", " + other.getFile());
		}
		int mStartColumn, mEndColumn;
		if(startLine == other.getStartLine()) {
			mStartColumn = Integer.min(startColumn, other.getStartColumn());
		}else if(startLine < other.getStartLine()) {
			mStartColumn = startColumn;
		}else /* startLine > other.getStartLine() */ {
			mStartColumn = other.getStartColumn();
		}
		if(endLine == other.getEndLine()) {
			mEndColumn = Integer.max(endColumn, other.getEndColumn());
		}else if(endLine > other.getEndLine()) {
			mEndColumn = endColumn;
		}else /* endLine < other.getEndLine() */ {
			mEndColumn = other.getEndColumn();
		}
		return new SourceLocation(file,
				Integer.min(startOffset, other.startOffset),
				Integer.max(endOffset, other.endOffset),
				Integer.min(startLine, other.getStartLine()),
				Integer.max(endLine, other.getEndLine()),
				mStartColumn,
				mEndColumn);
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		SourceLocation other = (SourceLocation) obj;
		return Objects.equals(file, other.file) && startOffset == other.startOffset && endOffset == other.endOffset
				&& startLine == other.startLine && endLine == other.endLine && startColumn == other.startColumn
				&& endColumn == other.endColumn;
	}

	@Override
	public int compareTo(SourceLocation o) {
		int cmp = Integer.compare(startOffset, o.startOffset);
		if(cmp != 0) {
			return cmp;
		}
		return Integer.compare(endOffset, o.endOffset);
	}

	@Override
	public String toString() {
		return "SourceLocation [" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn + "]";
	}
}

package txt2tex.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import txt2tex.Unreachable;
import txt2tex.lexer.ZToken;

/**
 * Decides which open binder or comprehension a '|' or '.' separator belongs to.
 *
 * Every binder and comprehension pushes a frame when it starts and pops it when its expression is complete.
 * A separator goes to the innermost frame that is still before its body; frames already reading their body
 * are passed over, so the separator ends them and belongs to an enclosing one. Brackets push barriers,
 * which separators never cross.
 */
public class SeparatorFrames {

	public enum Kind {
		BINDER,
		COMPREHENSION,
		BARRIER,
	}

	public enum State {
		BINDINGS,
		CONSTRAINT,
		BODY,
	}

	public static final class Frame {
		private final Kind kind;
		private final ZToken opener;
		private State state = State.BINDINGS;

		Frame(Kind kind, ZToken opener) {
			this.kind = kind;
			this.opener = opener;
		}

		public Kind getKind() {
			return kind;
		}

		public ZToken getOpener() {
			return opener;
		}

		public State getState() {
			return state;
		}

		public void advance(State next) {
			if(next.ordinal() <= state.ordinal()) {
				throw new Unreachable("separator frame moved from " + state + " to " + next);
			}
			state = next;
		}
	}

	private final Deque<Frame> frames = new ArrayDeque<>();

	public Frame push(Kind kind, ZToken opener) {
		Frame frame = new Frame(kind, opener);
		frames.push(frame);
		return frame;
	}

	public void pop(Frame frame) {
		if(frames.peek() != frame) {
			throw new Unreachable("separator frames popped out of order");
		}
		frames.pop();
	}

	/**
	 * @return the frame a separator read now would belong to, or null if it belongs to none
	 */
	public Frame owner() {
		Iterator<Frame> it = frames.iterator();
		while(it.hasNext()) {
			Frame f = it.next();
			if(f.kind == Kind.BARRIER) {
				return null;
			}
			if(f.state != State.BODY) {
				return f;
			}
		}
		return null;
	}

	public boolean isEmpty() {
		return frames.isEmpty();
	}

	public int size() {
		return frames.size();
	}
}

package txt2tex.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

import txt2tex.Unreachable;

public class SeparatorFramesTest {

	@Test
	public void emptyStackOwnsNothing() {
		SeparatorFrames frames = new SeparatorFrames();
		assertThat(frames.owner(), nullValue());
		assertTrue(frames.isEmpty());
	}

	@Test
	public void innermostOpenFrameOwnsTheSeparator() {
		SeparatorFrames frames = new SeparatorFrames();
		SeparatorFrames.Frame outer = frames.push(SeparatorFrames.Kind.BINDER, null);
		assertThat(frames.owner(), sameInstance(outer));
		SeparatorFrames.Frame inner = frames.push(SeparatorFrames.Kind.COMPREHENSION, null);
		assertThat(frames.owner(), sameInstance(inner));
		inner.advance(SeparatorFrames.State.CONSTRAINT);
		assertThat(frames.owner(), sameInstance(inner));
	}

	@Test
	public void framesReadingTheirBodyArePassedOver() {
		SeparatorFrames frames = new SeparatorFrames();
		SeparatorFrames.Frame outer = frames.push(SeparatorFrames.Kind.BINDER, null);
		outer.advance(SeparatorFrames.State.CONSTRAINT);
		SeparatorFrames.Frame inner = frames.push(SeparatorFrames.Kind.BINDER, null);
		inner.advance(SeparatorFrames.State.BODY);
		assertThat(frames.owner(), sameInstance(outer));
		outer.advance(SeparatorFrames.State.BODY);
		assertThat(frames.owner(), nullValue());
	}

	@Test
	public void barriersAreNeverCrossed() {
		SeparatorFrames frames = new SeparatorFrames();
		frames.push(SeparatorFrames.Kind.BINDER, null);
		SeparatorFrames.Frame barrier = frames.push(SeparatorFrames.Kind.BARRIER, null);
		assertThat(frames.owner(), nullValue());
		SeparatorFrames.Frame inner = frames.push(SeparatorFrames.Kind.BINDER, null);
		assertThat(frames.owner(), sameInstance(inner));
		frames.pop(inner);
		frames.pop(barrier);
		assertThat(frames.size(), is(1));
		assertThat(frames.owner().getKind(), is(SeparatorFrames.Kind.BINDER));
	}

	@Test(expected = Unreachable.class)
	public void framesOnlyMoveForward() {
		SeparatorFrames.Frame frame = new SeparatorFrames().push(SeparatorFrames.Kind.BINDER, null);
		frame.advance(SeparatorFrames.State.BODY);
		frame.advance(SeparatorFrames.State.CONSTRAINT);
	}

	@Test(expected = Unreachable.class)
	public void framesPopInOrder() {
		SeparatorFrames frames = new SeparatorFrames();
		SeparatorFrames.Frame outer = frames.push(SeparatorFrames.Kind.BINDER, null);
		frames.push(SeparatorFrames.Kind.BARRIER, null);
		frames.pop(outer);
	}
}

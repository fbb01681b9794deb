package txt2tex.scope;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

public class ChainMapTest {

	private Map<String, Integer> parent;
	private ChainMap<String, Integer> child;

	@Before
	public void setup() {
		parent = new HashMap<>();
		parent.put("a", 1);
		parent.put("b", 2);
		child = new ChainMap<>(parent);
	}

	@Test
	public void readsFallBackToTheParent() {
		assertThat(child.get("a"), is(1));
		assertTrue(child.containsKey("b"));
		assertThat(child.get("c"), nullValue());
	}

	@Test
	public void writesStayLocal() {
		child.put("a", 10);
		child.put("c", 3);
		assertThat(child.get("a"), is(10));
		assertThat(parent.get("a"), is(1));
		assertFalse(parent.containsKey("c"));
		assertThat(child.getMembers().keySet(), is(new HashSet<>(Arrays.asList("a", "c"))));
	}

	@Test
	public void removeOnlyTouchesLocalEntries() {
		child.put("a", 10);
		child.remove("a");
		assertThat(child.get("a"), is(1));
		child.remove("b");
		assertThat(child.get("b"), is(2));
	}

	@Test
	public void viewsMergeWithShadowing() {
		child.put("a", 10);
		child.put("c", 3);
		assertThat(child.size(), is(3));
		assertThat(child.keySet(), is(new HashSet<>(Arrays.asList("a", "b", "c"))));
		Map<String, Integer> merged = new HashMap<>();
		for(Map.Entry<String, Integer> e : child.entrySet()) {
			merged.put(e.getKey(), e.getValue());
		}
		assertThat(merged.get("a"), is(10));
		assertThat(merged.get("b"), is(2));
		assertTrue(child.containsValue(2));
		// the parent's value for "a" is shadowed
		assertFalse(child.containsValue(1));
		assertFalse(child.values().contains(1));
	}

	@Test
	public void membersKeepDeclarationOrder() {
		child.put("z", 26);
		child.put("m", 13);
		child.put("c", 3);
		assertThat(new ArrayList<>(child.getMembers().keySet()), is(Arrays.asList("z", "m", "c")));
		assertTrue(child.declaresLocally("m"));
		assertFalse(child.declaresLocally("a"));
	}

	@Test
	public void nullValuesShadowToo() {
		child.put("a", null);
		assertThat(child.get("a"), nullValue());
		assertTrue(child.containsKey("a"));
	}

	@Test
	public void chainsNest() {
		ChainMap<String, Integer> grandchild = new ChainMap<>(child);
		child.put("c", 3);
		grandchild.put("d", 4);
		assertThat(grandchild.get("a"), is(1));
		assertThat(grandchild.get("c"), is(3));
		assertThat(grandchild.getParent(), sameInstance((Map<String, Integer>) child));
		assertThat(child.getDepth(), is(1));
		assertThat(grandchild.getDepth(), is(2));
		assertFalse(child.containsKey("d"));
	}

	@Test
	public void clearOnlyClearsMembers() {
		child.put("c", 3);
		child.clear();
		assertFalse(child.containsKey("c"));
		assertFalse(child.isEmpty());
	}
}

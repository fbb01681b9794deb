package txt2tex.scope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One level of block scope layered over an enclosing map.
 *
 * Reads see this level first and then the parent; writes and removals only ever touch this level, so
 * leaving a block is just dropping its ChainMap. Entries declared here keep their declaration order.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class ChainMap<K, V> implements Map<K, V> {
	private final Map<K, V> parent;
	private final Map<K, V> members = new LinkedHashMap<>();
	private final int depth;

	public ChainMap(Map<K, V> parent) {
		this.parent = parent;
		this.depth = parent instanceof ChainMap ? ((ChainMap<?, ?>) parent).depth + 1 : 1;
	}

	public Map<K, V> getParent() {
		return parent;
	}

	/**
	 * @return only the entries declared at this level, in declaration order
	 */
	public Map<K, V> getMembers() {
		return members;
	}

	/**
	 * @return how many ChainMaps are stacked here, counting this one
	 */
	public int getDepth() {
		return depth;
	}

	public boolean declaresLocally(Object k) {
		return members.containsKey(k);
	}

	// the visible entries: this level first, then whatever it does not shadow
	private Map<K, V> flatten() {
		Map<K, V> result = new LinkedHashMap<>(members);
		for(Entry<K, V> e : parent.entrySet()) {
			if(!result.containsKey(e.getKey())) {
				result.put(e.getKey(), e.getValue());
			}
		}
		return result;
	}

	@Override
	public V get(Object k) {
		if(members.containsKey(k)) {
			return members.get(k);
		}
		return parent.get(k);
	}

	@Override
	public boolean containsKey(Object k) {
		return members.containsKey(k) || parent.containsKey(k);
	}

	@Override
	public boolean containsValue(Object v) {
		return flatten().containsValue(v);
	}

	@Override
	public V put(K k, V v) {
		return members.put(k, v);
	}

	@Override
	public void putAll(Map<? extends K, ? extends V> m) {
		members.putAll(m);
	}

	@Override
	public V remove(Object k) {
		return members.remove(k);
	}

	@Override
	public void clear() {
		members.clear();
	}

	@Override
	public boolean isEmpty() {
		return members.isEmpty() && parent.isEmpty();
	}

	@Override
	public int size() {
		return keySet().size();
	}

	@Override
	public Set<K> keySet() {
		Set<K> keys = new LinkedHashSet<>(members.keySet());
		keys.addAll(parent.keySet());
		return keys;
	}

	@Override
	public Collection<V> values() {
		return new ArrayList<>(flatten().values());
	}

	@Override
	public Set<Entry<K, V>> entrySet() {
		return flatten().entrySet();
	}

	@Override
	public String toString() {
		return "ChainMap" + members + " -> " + parent;
	}
}

package edu.upf.taln.treediff.core.structures;

import java.util.*;

import static java.util.stream.Collectors.toList;

/**
 * Forest of identities assigned to the fragments of one linearized tree. Each identity owns one fragment,
 * has at most one parent and an ordered list of children. Identities are kept in registration order.
 */
public final class NamedTree
{
	public static final class Entry
	{
		private final String id;
		private final String parent; // null for roots
		private final Fragment fragment;
		private final List<String> children = new ArrayList<>();

		private Entry(String id, String parent, Fragment fragment)
		{
			this.id = id;
			this.parent = parent;
			this.fragment = fragment;
		}

		public String getId() { return id; }
		public Optional<String> getParent() { return Optional.ofNullable(parent); }
		public boolean isRoot() { return parent == null; }
		public Fragment getFragment() { return fragment; }
		public List<String> getChildren() { return Collections.unmodifiableList(children); }

		@Override
		public String toString()
		{
			return id + "{parent=" + (parent == null ? "-" : parent) + ", children=" + children + ", tree=" + fragment + "}";
		}
	}

	private final String prefix;
	private final Map<String, Entry> entries = new LinkedHashMap<>();

	public NamedTree(String prefix)
	{
		this.prefix = prefix;
	}

	public String getPrefix() { return prefix; }

	/**
	 * Registers a new identity, appending it to the children of its parent if it has one
	 */
	public void register(String id, String parent, Fragment fragment)
	{
		if (entries.containsKey(id))
			throw new IllegalArgumentException("Identity " + id + " already registered");
		if (parent != null && !entries.containsKey(parent))
			throw new IllegalArgumentException("Unknown parent identity " + parent + " for " + id);

		entries.put(id, new Entry(id, parent, fragment));
		if (parent != null)
			entries.get(parent).children.add(id);
	}

	public boolean contains(String id) { return entries.containsKey(id); }

	public Entry get(String id)
	{
		final Entry entry = entries.get(id);
		if (entry == null)
			throw new NoSuchElementException("No identity " + id + " in tree " + prefix);
		return entry;
	}

	public Fragment getFragment(String id) { return get(id).getFragment(); }

	public Set<String> getIdentities() { return Collections.unmodifiableSet(entries.keySet()); }

	public Collection<Entry> getEntries() { return Collections.unmodifiableCollection(entries.values()); }

	public List<String> getRoots()
	{
		return entries.values().stream()
				.filter(Entry::isRoot)
				.map(Entry::getId)
				.collect(toList());
	}

	public int size() { return entries.size(); }

	@Override
	public String toString()
	{
		StringBuilder b = new StringBuilder();
		entries.values().forEach(e -> b.append(e).append("\n"));
		return b.toString();
	}
}

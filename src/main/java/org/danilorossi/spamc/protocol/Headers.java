package org.danilorossi.spamc.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.NonNull;
import lombok.Value;
import lombok.val;

/**
 * Ordered header multimap. Entries keep the caller's casing and insertion order (that is the order
 * they go on the wire); lookups ignore case. The same name may appear more than once.
 *
 * <p>A frozen instance rejects every mutation; requests and responses only hand out frozen
 * copies.
 */
public final class Headers implements Iterable<Headers.Entry> {

  public static final String CONTENT_LENGTH = "Content-length";
  public static final String COMPRESS = "Compress";
  public static final String USER = "User";
  public static final String SPAM = "Spam";
  public static final String MESSAGE_CLASS = "Message-class";
  public static final String SET = "Set";
  public static final String REMOVE = "Remove";
  public static final String DID_SET = "DidSet";
  public static final String DID_REMOVE = "DidRemove";

  @Value
  public static class Entry {
    String name;
    String value;

    public boolean is(final String other) {
      return name.equalsIgnoreCase(other);
    }

    @Override
    public String toString() {
      return name + ": " + value;
    }
  }

  private final List<Entry> entries;
  private final boolean frozen;

  public Headers() {
    this(new ArrayList<>(), false);
  }

  private Headers(final List<Entry> entries, final boolean frozen) {
    this.entries = entries;
    this.frozen = frozen;
  }

  public static Headers of(final String... nameValuePairs) {
    if (nameValuePairs.length % 2 != 0)
      throw new IllegalArgumentException("Expected name/value pairs");
    val h = new Headers();
    for (int i = 0; i < nameValuePairs.length; i += 2) h.add(nameValuePairs[i], nameValuePairs[i + 1]);
    return h;
  }

  /** Appends an entry; existing entries with the same name are kept. */
  public Headers add(@NonNull final String name, @NonNull final String value) {
    ensureMutable();
    entries.add(new Entry(name, value));
    return this;
  }

  /**
   * Replaces every entry with this name by a single one. The new entry takes the position of the
   * first replaced entry, or goes last.
   */
  public Headers set(@NonNull final String name, @NonNull final String value) {
    ensureMutable();
    int at = -1;
    for (int i = 0; i < entries.size(); i++) {
      if (entries.get(i).is(name)) {
        at = i;
        break;
      }
    }
    entries.removeIf(e -> e.is(name));
    if (at < 0) entries.add(new Entry(name, value));
    else entries.add(at, new Entry(name, value));
    return this;
  }

  /** Inserts an entry in front of all others. */
  public Headers addFirst(@NonNull final String name, @NonNull final String value) {
    ensureMutable();
    entries.add(0, new Entry(name, value));
    return this;
  }

  public boolean remove(@NonNull final String name) {
    ensureMutable();
    return entries.removeIf(e -> e.is(name));
  }

  /** Appends the last line's continuation to the most recent entry (header folding). */
  public Headers appendToLast(@NonNull final String continuation) {
    ensureMutable();
    if (entries.isEmpty()) throw new IllegalStateException("No header to continue");
    val last = entries.remove(entries.size() - 1);
    entries.add(new Entry(last.getName(), (last.getValue() + " " + continuation).trim()));
    return this;
  }

  public Optional<String> get(@NonNull final String name) {
    for (val e : entries) if (e.is(name)) return Optional.of(e.getValue());
    return Optional.empty();
  }

  public List<String> getAll(@NonNull final String name) {
    return entries.stream().filter(e -> e.is(name)).map(Entry::getValue).collect(Collectors.toList());
  }

  /** The entry as stored, with the caller's casing. */
  public Optional<Entry> getEntry(@NonNull final String name) {
    for (val e : entries) if (e.is(name)) return Optional.of(e);
    return Optional.empty();
  }

  public boolean contains(@NonNull final String name) {
    return get(name).isPresent();
  }

  public List<Entry> entries() {
    return Collections.unmodifiableList(entries);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public boolean isFrozen() {
    return frozen;
  }

  public Headers copy() {
    return new Headers(new ArrayList<>(entries), false);
  }

  /** Read-only snapshot; returns this when already frozen. */
  public Headers freeze() {
    if (frozen) return this;
    return new Headers(Collections.unmodifiableList(new ArrayList<>(entries)), true);
  }

  private void ensureMutable() {
    if (frozen) throw new UnsupportedOperationException("Headers are read-only");
  }

  @Override
  public Iterator<Entry> iterator() {
    return entries().iterator();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof Headers)) return false;
    return entries.equals(((Headers) o).entries);
  }

  @Override
  public int hashCode() {
    return Objects.hash(entries);
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}

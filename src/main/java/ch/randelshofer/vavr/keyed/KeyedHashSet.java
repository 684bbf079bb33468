/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2023 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.keyed;

import io.vavr.Tuple2;
import io.vavr.collection.HashMap;
import io.vavr.collection.Iterator;
import io.vavr.collection.Map;
import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collector;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Implements a mutable set of values that contain their own key.
 * <p>
 * Unlike {@link java.util.HashSet} or {@link java.util.HashMap}, changing
 * the key of a stored value is not an error, provided the change is made
 * through one of the mutation protocols of this set:
 * <ul>
 *     <li>{@link #modify(Object, Function)}, {@link #modifyAll(Consumer)} and
 *     {@link #retain(Predicate)} apply a function and relocate the value
 *     afterwards</li>
 *     <li>{@link #getMut(Object)} and {@link #getOrInsertWith(Object, Function)}
 *     hand out a {@link Guard} which relocates the value when it is closed</li>
 * </ul>
 * After any public method returns, every value {@code e} in the set is
 * stored under {@code e.key()}.
 * <p>
 * Features:
 * <ul>
 *     <li>allows a null key, does not allow null values</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 *     <li>does not guarantee a specific iteration order</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>insert: O(1)</li>
 *     <li>remove: O(1)</li>
 *     <li>contains: O(1)</li>
 *     <li>modify: O(1)</li>
 *     <li>retain: O(N)</li>
 *     <li>iterator creation: O(1)</li>
 *     <li>toMap: O(1)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * The values are stored in a persistent {@link HashMap} from key to value.
 * Every write replaces the map, so a reference to the map taken before a
 * write is an unaffected snapshot. {@link #retain(Predicate)} iterates such
 * a snapshot while it rewrites the current map.
 * <p>
 * While a function passed to a mutation protocol runs, or while a guard is
 * open, the set is <i>borrowed</i>: the stored keys may be out of date, and
 * every other operation on the set throws an {@link IllegalStateException}.
 * <p>
 * Relocating a value to a key that is already occupied displaces the
 * occupant, just like {@link #insert(Keyed)} does.
 *
 * @param <K> the key type
 * @param <E> the element type
 */
public class KeyedHashSet<K, E extends Keyed<K>> implements Iterable<E> {

    private HashMap<K, E> root;
    /**
     * Incremented on every structural change and on every borrow.
     * Iterators fail when it changes under them.
     */
    private int modCount;
    private boolean borrowed;

    /**
     * Creates an empty set.
     */
    public KeyedHashSet() {
        this(HashMap.empty());
    }

    private KeyedHashSet(HashMap<K, E> root) {
        this.root = root;
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain a {@link KeyedHashSet}.
     * Later elements displace earlier elements with the same key.
     *
     * @param <K> the key type
     * @param <E> the element type
     * @return a {@link KeyedHashSet} Collector
     */
    public static <K, E extends Keyed<K>> Collector<E, ArrayList<E>, KeyedHashSet<K, E>> collector() {
        return Collections.toListAndThen(KeyedHashSet::ofAll);
    }

    /**
     * Returns a new, empty set.
     *
     * @param <K> the key type
     * @param <E> the element type
     * @return an empty set
     */
    public static <K, E extends Keyed<K>> KeyedHashSet<K, E> empty() {
        return new KeyedHashSet<>();
    }

    /**
     * Creates a KeyedHashSet of the given elements.
     *
     * @param elements zero or more elements
     * @param <K>      the key type
     * @param <E>      the element type
     * @return a set containing the given elements
     * @throws NullPointerException if {@code elements} or one of the elements is null
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public static <K, E extends Keyed<K>> KeyedHashSet<K, E> of(E... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return ofAll(Arrays.asList(elements));
    }

    /**
     * Creates a KeyedHashSet of the given elements.
     *
     * @param elements set elements
     * @param <K>      the key type
     * @param <E>      the element type
     * @return a set containing the given elements
     * @throws NullPointerException if {@code elements} or one of the elements is null
     */
    public static <K, E extends Keyed<K>> KeyedHashSet<K, E> ofAll(Iterable<? extends E> elements) {
        Objects.requireNonNull(elements, "elements is null");
        KeyedHashSet<K, E> set = new KeyedHashSet<>();
        for (E element : elements) {
            set.insert(element);
        }
        return set;
    }

    /**
     * Inserts an element under its current key.
     *
     * @param element an element
     * @return the element that was previously stored under the same key, if any
     * @throws NullPointerException if {@code element} is null
     */
    public Option<E> insert(E element) {
        Objects.requireNonNull(element, "element is null");
        checkNotBorrowed();
        K key = element.key();
        Option<E> displaced = root.get(key);
        root = root.put(key, element);
        modCount++;
        return displaced;
    }

    /**
     * Gets the element with the given key.
     *
     * @param key a key, any object that is equal to a key of this set will do
     * @return the element, or {@link Option#none()} if there is none
     */
    public Option<E> get(Object key) {
        checkNotBorrowed();
        return root.get(asKey(key));
    }

    /**
     * Gets the element with the given key, for callers that know that it is present.
     *
     * @param key a key
     * @return the element
     * @throws NoSuchElementException if the set has no element with this key
     */
    public E apply(Object key) {
        return get(key).getOrElseThrow(() -> new NoSuchElementException("key not found"));
    }

    /**
     * Tests whether the set has an element with the given key.
     *
     * @param key a key, any object that is equal to a key of this set will do
     * @return true if an element is stored under this key
     */
    public boolean contains(Object key) {
        checkNotBorrowed();
        return root.containsKey(asKey(key));
    }

    /**
     * Removes the element with the given key.
     *
     * @param key a key
     * @return the removed element, or {@link Option#none()} if there was none
     */
    public Option<E> remove(Object key) {
        checkNotBorrowed();
        K k = asKey(key);
        Option<E> removed = root.get(k);
        if (removed.isDefined()) {
            root = root.remove(k);
            modCount++;
        }
        return removed;
    }

    /**
     * Returns the number of elements. Does not require the set to be unborrowed.
     *
     * @return the number of elements
     */
    public int size() {
        return root.size();
    }

    public boolean isEmpty() {
        return root.isEmpty();
    }

    /**
     * Removes all elements.
     */
    public void clear() {
        checkNotBorrowed();
        if (!root.isEmpty()) {
            root = HashMap.empty();
            modCount++;
        }
    }

    /**
     * Returns an iterator over the keys of this set.
     * <p>
     * The iterator throws a {@link ConcurrentModificationException} if the set
     * is modified or borrowed after the iterator has been created.
     *
     * @return a new iterator
     */
    public Iterator<K> keys() {
        checkNotBorrowed();
        return new FailFastIterator<>(root.keysIterator());
    }

    /**
     * Returns an iterator over the elements of this set.
     * <p>
     * The iterator throws a {@link ConcurrentModificationException} if the set
     * is modified or borrowed after the iterator has been created.
     *
     * @return a new iterator
     */
    @Override
    public Iterator<E> iterator() {
        checkNotBorrowed();
        return new FailFastIterator<>(root.valuesIterator());
    }

    @Override
    public Spliterator<E> spliterator() {
        return Spliterators.spliterator(iterator(), size(), Spliterator.DISTINCT | Spliterator.NONNULL);
    }

    /**
     * Returns a sequential {@link Stream} over the elements of this set.
     *
     * @return a new stream
     */
    public Stream<E> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Removes all elements from this set and returns an iterator over them.
     * <p>
     * Unlike {@link #iterator()}, the returned iterator is not affected by
     * later changes of this set.
     *
     * @return an iterator over the former elements of this set
     */
    public Iterator<E> drain() {
        checkNotBorrowed();
        Iterator<E> drained = root.valuesIterator();
        clear();
        return drained;
    }

    /**
     * Returns a snapshot of this set as an immutable map from key to element.
     * The snapshot does not change when this set changes; the elements
     * themselves are shared.
     *
     * @return a map from key to element
     */
    public Map<K, E> toMap() {
        checkNotBorrowed();
        return root;
    }

    /**
     * Returns a new set that contains a copy of each element of this set.
     * <p>
     * Passing {@link UnaryOperator#identity()} shares the elements between
     * both sets; a key change made through one set then leaves the other
     * set with a stale key.
     *
     * @param copier creates a copy of an element
     * @return a new set
     */
    public KeyedHashSet<K, E> copy(UnaryOperator<E> copier) {
        Objects.requireNonNull(copier, "copier is null");
        checkNotBorrowed();
        KeyedHashSet<K, E> copy = new KeyedHashSet<>();
        root.valuesIterator().forEach(e -> copy.insert(copier.apply(e)));
        return copy;
    }

    /**
     * Modifies the element with the given key.
     * <p>
     * If the key of the element has changed after {@code f} returns, the
     * element is moved to its new key. This also happens if {@code f} throws.
     *
     * @param key a key
     * @param f   a function that may mutate the element, invoked at most once
     * @param <R> the result type of {@code f}
     * @return the result of {@code f}, or {@link Option#none()} if the set has
     * no element with this key
     */
    public <R> Option<R> modify(Object key, Function<? super E, ? extends R> f) {
        Objects.requireNonNull(f, "f is null");
        checkNotBorrowed();
        K k = asKey(key);
        Option<E> found = root.get(k);
        if (found.isEmpty()) {
            return Option.none();
        }
        E element = found.get();
        borrow();
        try {
            return Option.some(f.apply(element));
        } finally {
            release();
            relocate(k, element);
        }
    }

    /**
     * Applies {@code f} to every element of this set and moves each element
     * whose key has changed.
     *
     * @param f a function that may mutate an element
     */
    public void modifyAll(Consumer<? super E> f) {
        Objects.requireNonNull(f, "f is null");
        retain(e -> {
            f.accept(e);
            return true;
        });
    }

    /**
     * Retains the elements that satisfy the given predicate.
     * <p>
     * The predicate may mutate the element it is given. Retained elements
     * whose key has changed are moved to their new key.
     * <p>
     * The predicate is invoked exactly once for each element that was in the
     * set when this method was called. Moved elements are inserted under
     * their new key only after all elements have been visited, so a moved
     * element can only displace another retained element, just like
     * {@link #insert(Keyed)} does.
     * <p>
     * If the predicate throws, the element at hand is retained, the elements
     * visited so far are settled, and the elements that have not been visited
     * yet are left as they are.
     *
     * @param predicate decides which elements to retain
     * @return true if this set has changed
     */
    public boolean retain(Predicate<? super E> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        checkNotBorrowed();
        HashMap<K, E> snapshot = root;
        ArrayList<E> moved = new ArrayList<>();
        boolean changed = false;
        try {
            for (Tuple2<K, E> entry : snapshot) {
                K slot = entry._1;
                E element = entry._2;
                boolean keep = true;
                borrow();
                try {
                    keep = predicate.test(element);
                } finally {
                    release();
                    if (!keep || !Objects.equals(slot, element.key())) {
                        root = root.remove(slot);
                        modCount++;
                        changed = true;
                        if (keep) {
                            moved.add(element);
                        }
                    }
                }
            }
        } finally {
            for (E element : moved) {
                root = root.put(element.key(), element);
                modCount++;
            }
        }
        return changed;
    }

    /**
     * Gets the element with the given key for modification.
     * <p>
     * The set is borrowed until the guard is closed. Use the guard with a
     * try-with-resources statement:
     * <pre><code>
     * try (KeyedHashSet.Guard&lt;String, Item&gt; guard = set.getMut("3").get()) {
     *     guard.get().setName("three");
     * }
     * </code></pre>
     *
     * @param key a key
     * @return a guard for the element, or {@link Option#none()} if the set has
     * no element with this key
     */
    public Option<Guard<K, E>> getMut(Object key) {
        checkNotBorrowed();
        K k = asKey(key);
        return root.containsKey(k) ? Option.some(new Guard<>(this, k)) : Option.none();
    }

    /**
     * Gets the element with the given key for modification, creating it with
     * {@code factory} if the set has no element with this key.
     * <p>
     * The created element is stored under {@code key}. It should report
     * {@code key} as its key; if it does not, it is moved to the key it reports
     * when the guard is closed.
     *
     * @param key     a key
     * @param factory creates a new element for {@code key}, only invoked if the key is absent
     * @return a guard for the element
     * @throws NullPointerException if {@code factory} is null or returns null
     */
    public Guard<K, E> getOrInsertWith(K key, Function<? super K, ? extends E> factory) {
        Objects.requireNonNull(factory, "factory is null");
        checkNotBorrowed();
        if (!root.containsKey(key)) {
            E element;
            borrow();
            try {
                element = factory.apply(key);
            } finally {
                release();
            }
            Objects.requireNonNull(element, "factory returned null");
            root = root.put(key, element);
            modCount++;
        }
        return new Guard<>(this, key);
    }

    /**
     * Moves the element from {@code slot} to its current key, if the two differ.
     */
    private boolean relocate(K slot, E element) {
        K newKey = element.key();
        if (Objects.equals(slot, newKey)) {
            return false;
        }
        if (isStoredAt(slot, element)) {
            root = root.remove(slot);
        }
        root = root.put(newKey, element);
        modCount++;
        return true;
    }

    private boolean isStoredAt(K slot, E element) {
        return root.get(slot).exists(stored -> stored == element);
    }

    private void borrow() {
        checkNotBorrowed();
        borrowed = true;
        modCount++;
    }

    private void release() {
        borrowed = false;
    }

    private void checkNotBorrowed() {
        if (borrowed) {
            throw new IllegalStateException("KeyedHashSet is borrowed");
        }
    }

    @SuppressWarnings("unchecked")
    private K asKey(Object key) {
        return (K) key;
    }

    @Override
    public boolean equals(Object other) {
        if (other == this) {
            return true;
        }
        if (other instanceof KeyedHashSet) {
            KeyedHashSet<?, ?> that = (KeyedHashSet<?, ?>) other;
            return root.equals(that.root);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    public String stringPrefix() {
        return "KeyedHashSet";
    }

    @Override
    public String toString() {
        return root.valuesIterator().mkString(stringPrefix() + "(", ", ", ")");
    }

    private final class FailFastIterator<T> implements Iterator<T> {
        private final Iterator<T> delegate;
        private final int expectedModCount;

        FailFastIterator(Iterator<T> delegate) {
            this.delegate = delegate;
            this.expectedModCount = modCount;
        }

        @Override
        public boolean hasNext() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            return delegate.hasNext();
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException("next() on empty iterator");
            }
            return delegate.next();
        }
    }

    /**
     * Gives mutable access to one element of a {@link KeyedHashSet}.
     * <p>
     * The guard borrows the whole set until {@link #close()} is called.
     * Closing the guard moves the element to its current key, if it has
     * changed. Only one guard can be open on a set at a time.
     *
     * @param <K> the key type
     * @param <E> the element type
     */
    public static final class Guard<K, E extends Keyed<K>> implements AutoCloseable {
        private final KeyedHashSet<K, E> owner;
        private final K key;
        private boolean closed;

        private Guard(KeyedHashSet<K, E> owner, K key) {
            owner.borrow();
            this.owner = owner;
            this.key = key;
        }

        /**
         * Returns the key under which the element was stored when this guard
         * was created.
         *
         * @return the remembered key
         */
        public K key() {
            return key;
        }

        /**
         * Returns the element that is stored under the remembered key.
         *
         * @return the element
         * @throws IllegalStateException if this guard is closed
         */
        public E get() {
            checkOpen();
            return owner.root.get(key).get();
        }

        /**
         * Replaces the element that is stored under the remembered key.
         *
         * @param element the new element
         * @throws IllegalStateException if this guard is closed
         */
        public void set(E element) {
            Objects.requireNonNull(element, "element is null");
            checkOpen();
            owner.root = owner.root.put(key, element);
            owner.modCount++;
        }

        /**
         * Applies {@code f} to the element that is stored under the remembered key.
         * A key change made by {@code f} is applied when this guard is closed.
         *
         * @param f   a function that may mutate the element
         * @param <R> the result type of {@code f}
         * @return the result of {@code f}
         * @throws IllegalStateException if this guard is closed
         */
        public <R> R apply(Function<? super E, ? extends R> f) {
            Objects.requireNonNull(f, "f is null");
            return f.apply(get());
        }

        /**
         * @return true if {@link #close()} has been called
         */
        public boolean isClosed() {
            return closed;
        }

        /**
         * Releases the set, and moves the element to its current key if it
         * has changed. Does nothing if this guard is already closed.
         */
        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            owner.release();
            owner.relocate(key, owner.root.get(key).get());
        }

        private void checkOpen() {
            if (closed) {
                throw new IllegalStateException("Guard is closed");
            }
        }
    }
}

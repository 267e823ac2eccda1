// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.AlreadyAttachedException;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * An ordered tree node with exclusive ownership of its children.
 * <p>
 * A node is attached to at most one parent.  Attaching a node that already
 * has a parent throws {@link AlreadyAttachedException}; callers must
 * {@link #detach()} it first.  Attaching a node into itself or into one of
 * its own descendants throws {@link IllegalArgumentException}, so a tree can
 * never contain a cycle.
 * <p>
 * Nodes use identity equality.  Use {@link #contentEquals(Node)} for a deep
 * structural comparison.
 *
 * @param <N> the concrete node type of the tree.
 */
public abstract class Node<N extends Node<N>>
    implements Iterable<N>
{
    private static final Node<?>[] EMPTY_CHILDREN = new Node<?>[0];

    private Node<N>   _parent;

    /** Index of this node in its parent's children; -1 when detached. */
    private int       _elementid = -1;

    private Node<?>[] _children = EMPTY_CHILDREN;
    private int       _child_count;


    protected Node()
    {
    }


    @SuppressWarnings("unchecked")
    private N self()
    {
        return (N) this;
    }

    @SuppressWarnings("unchecked")
    final N get_child(int index)
    {
        return (N) _children[index];
    }


    /**
     * Called after the children of this node changed in any way.  The
     * default implementation does nothing.
     */
    protected void childrenChanged()
    {
    }


    //=========================================================================
    // Structure queries

    /**
     * Returns the parent of this node.
     *
     * @return null if this node is a root.
     */
    @SuppressWarnings("unchecked")
    public final N getParent()
    {
        return (N) _parent;
    }

    public final int size()
    {
        return _child_count;
    }

    public final boolean isEmpty()
    {
        return _child_count == 0;
    }

    /**
     * Returns the child at the given index.
     *
     * @throws IndexOutOfBoundsException if the index is out of range.
     */
    public final N get(int index)
    {
        checkIndex(index, _child_count);
        return get_child(index);
    }

    /**
     * Returns a read-only view of the children.  The view reflects later
     * changes of this node.
     */
    public final List<N> getChildren()
    {
        return new AbstractList<N>()
        {
            @Override
            public N get(int index)
            {
                return Node.this.get(index);
            }

            @Override
            public int size()
            {
                return _child_count;
            }
        };
    }

    /**
     * Returns an iterator over the children.  Its {@link Iterator#remove()}
     * detaches the current child.
     */
    public final Iterator<N> iterator()
    {
        return new ChildIterator();
    }

    /**
     * Iterates the children from last to first.
     */
    public final Iterable<N> reversed()
    {
        return new Iterable<N>()
        {
            public Iterator<N> iterator()
            {
                return new Iterator<N>()
                {
                    private int myIndex = _child_count;

                    public boolean hasNext()
                    {
                        return myIndex > 0 && myIndex <= _child_count;
                    }

                    public N next()
                    {
                        if (!hasNext()) throw new NoSuchElementException();
                        return get_child(--myIndex);
                    }
                };
            }
        };
    }

    /**
     * Returns the children for which the predicate holds, in order.
     */
    public final List<N> childrenMatching(Predicate<? super N> predicate)
    {
        List<N> result = new ArrayList<N>();
        for (int i = 0; i < _child_count; i++)
        {
            N child = get_child(i);
            if (predicate.test(child)) result.add(child);
        }
        return result;
    }

    /**
     * Returns the index of this node in its parent.
     *
     * @return -1 if this node has no parent.
     */
    public final int indexInParent()
    {
        return _elementid;
    }

    public final N getRoot()
    {
        Node<N> node = this;
        while (node._parent != null)
        {
            node = node._parent;
        }
        return node.self();
    }

    public final boolean isRoot()
    {
        return _parent == null;
    }

    /**
     * Determines whether this node is the first child of its parent.  A root
     * node is neither first nor last.
     */
    public final boolean isFirst()
    {
        return _parent != null && _elementid == 0;
    }

    public final boolean isLast()
    {
        return _parent != null && _elementid == _parent._child_count - 1;
    }

    public final N leftSibling()
    {
        if (_parent == null || _elementid == 0) return null;
        return _parent.get_child(_elementid - 1);
    }

    public final N rightSibling()
    {
        if (_parent == null || _elementid + 1 >= _parent._child_count) return null;
        return _parent.get_child(_elementid + 1);
    }

    /**
     * Returns the number of ancestors of this node.
     */
    public final int getDepth()
    {
        int depth = 0;
        for (Node<N> n = _parent; n != null; n = n._parent)
        {
            depth++;
        }
        return depth;
    }

    /**
     * Returns the longest distance from this node to one of its descendants.
     */
    public final int getHeight()
    {
        int height = 0;
        for (int i = 0; i < _child_count; i++)
        {
            height = Math.max(height, get_child(i).getHeight() + 1);
        }
        return height;
    }

    /**
     * Returns the indices of this node and its ancestors in their parents,
     * starting at the root; the node's own index comes last.  Trails compare
     * in document order.
     */
    public final List<Integer> trail()
    {
        Integer[] trail = new Integer[getDepth()];
        int i = trail.length;
        for (Node<N> n = this; n._parent != null; n = n._parent)
        {
            trail[--i] = n._elementid;
        }
        return Arrays.asList(trail);
    }

    /**
     * Iterates the ancestors of this node, nearest first.
     */
    public final Iterable<N> ancestors()
    {
        return new Iterable<N>()
        {
            public Iterator<N> iterator()
            {
                return new Iterator<N>()
                {
                    private Node<N> myNext = _parent;

                    public boolean hasNext()
                    {
                        return myNext != null;
                    }

                    public N next()
                    {
                        if (myNext == null) throw new NoSuchElementException();
                        N result = myNext.self();
                        myNext = myNext._parent;
                        return result;
                    }
                };
            }
        };
    }

    /**
     * Returns the nearest strict ancestor for which the predicate holds.
     *
     * @return null if there is none.
     */
    public final N findAncestor(Predicate<? super N> predicate)
    {
        for (N n : ancestors())
        {
            if (predicate.test(n)) return n;
        }
        return null;
    }

    /**
     * Determines whether this node is the given node or one of its
     * descendants.
     */
    public final boolean isDescendantOrSelf(Node<?> ancestor)
    {
        for (Node<N> n = this; n != null; n = n._parent)
        {
            if (n == ancestor) return true;
        }
        return false;
    }

    /**
     * Returns the youngest node that is an ancestor of (or equal to) both this
     * node and the other one.
     *
     * @return null if the nodes are in different trees.
     */
    public final N commonAncestor(N other)
    {
        if (other == this) return self();
        int depth = getDepth();
        int otherDepth = other.getDepth();
        Node<N> a = this;
        Node<N> b = other;
        for (; depth > otherDepth; depth--)
        {
            a = a._parent;
        }
        for (; otherDepth > depth; otherDepth--)
        {
            b = b._parent;
        }
        while (a != b)
        {
            a = a._parent;
            b = b._parent;
        }
        return a == null ? null : a.self();
    }

    /**
     * Iterates all descendants of this node in document order (pre-order).
     * Each call of {@link Iterable#iterator()} restarts the walk.
     */
    public final Iterable<N> descendants()
    {
        return new Walk<N>(self(), self(), true, false);
    }

    /**
     * Iterates all descendants in backward document order: each node is
     * followed by its own children from last to first.
     */
    public final Iterable<N> descendantsReversed()
    {
        return new Walk<N>(self(), self(), true, true);
    }

    /**
     * Iterates the descendants for which the predicate holds, in document
     * order.  The sequence is lazy and can be restarted.
     */
    public final Iterable<N> findDescendants(final Predicate<? super N> predicate)
    {
        final Iterable<N> all = descendants();
        return new Iterable<N>()
        {
            public Iterator<N> iterator()
            {
                return new FilterIterator<N>(all.iterator(), predicate);
            }
        };
    }

    /**
     * Iterates the nodes following this one in document order, starting with
     * its right sibling.  The descendants of this node are not included.
     *
     * @param upto an ancestor that bounds the walk, or null to walk up to the
     * root.
     */
    public final Iterable<N> forward(N upto)
    {
        return new Walk<N>(self(), upto, false, false);
    }

    public final Iterable<N> forward()
    {
        return forward(null);
    }

    /**
     * Iterates the nodes preceding this one in backward document order,
     * starting with its left sibling.
     *
     * @param upto an ancestor that bounds the walk, or null to walk up to the
     * root.
     */
    public final Iterable<N> backward(N upto)
    {
        return new Walk<N>(self(), upto, false, true);
    }

    public final Iterable<N> backward()
    {
        return backward(null);
    }


    //=========================================================================
    // Mutation

    /**
     * Appends a child.
     *
     * @throws NullPointerException if {@code child} is null.
     * @throws AlreadyAttachedException if {@code child} already has a parent.
     * @throws IllegalArgumentException if {@code child} is this node or one of
     * its ancestors.
     */
    public final void add(N child)
    {
        add(_child_count, child);
    }

    /**
     * Inserts a child at the given index.
     *
     * @throws IndexOutOfBoundsException if the index is not within
     * {@code [0, size()]}.
     */
    public final void add(int index, N child)
    {
        checkIndex(index, _child_count + 1);
        validateNewChild(child);
        add_child(index, child);
        childrenChanged();
    }

    /**
     * Appends all nodes of the collection.  Every node is validated before
     * any is attached, so a failure leaves this node unchanged.
     */
    public final void addAll(Collection<? extends N> children)
    {
        List<N> checked = new ArrayList<N>(children.size());
        for (N child : children)
        {
            validateNewChild(child);
            for (N other : checked)
            {
                if (other == child)
                {
                    throw new AlreadyAttachedException("node added twice");
                }
            }
            checked.add(child);
        }
        for (N child : checked)
        {
            add_child(_child_count, child);
        }
        if (!checked.isEmpty()) childrenChanged();
    }

    /**
     * Replaces the child at the given index.
     *
     * @return the replaced child, which is now detached.
     */
    public final N set(int index, N child)
    {
        checkIndex(index, _child_count);
        validateNewChild(child);
        Node<N> old = get_child(index);
        old.detachFromParent();
        Node<N> node = child;
        _children[index] = node;
        node._parent = this;
        node._elementid = index;
        childrenChanged();
        return old.self();
    }

    /**
     * Removes the child at the given index.
     *
     * @return the removed child, which is now detached.
     */
    public final N remove(int index)
    {
        checkIndex(index, _child_count);
        N child = remove_child(index);
        childrenChanged();
        return child;
    }

    /**
     * Removes the given child, compared by identity.
     *
     * @return true if the node was a child of this node.
     */
    public final boolean remove(N child)
    {
        if (child == null) throw new NullPointerException();
        Node<N> node = child;
        if (node._parent != this) return false;

        int index = node._elementid;
        if (get_child(index) != child)  // Yes, instance identity.
        {
            throw new AssertionError("child index is not correct");
        }
        remove_child(index);
        childrenChanged();
        return true;
    }

    /**
     * Removes all children.
     */
    public final void clear()
    {
        if (_child_count == 0) return;
        for (int i = 0; i < _child_count; i++)
        {
            _children[i].detachFromParent();
            _children[i] = null;
        }
        _child_count = 0;
        childrenChanged();
    }

    /**
     * Removes this node from its parent, if it has one.
     */
    public final void detach()
    {
        if (_parent != null)
        {
            _parent.remove(self());
        }
    }

    /**
     * Puts the given node in the place of this one in its parent.  This node
     * is detached afterwards.
     *
     * @throws IllegalStateException if this node has no parent.
     */
    public final void replaceWith(N node)
    {
        if (_parent == null)
        {
            throw new IllegalStateException("node has no parent");
        }
        if (node == this) return;
        _parent.set(_elementid, node);
    }


    //=========================================================================
    // Comparison

    /**
     * Determines whether this node and the other one are structurally equal:
     * same class, same number of children, {@link #bodyEquals(Node)}, and
     * pairwise content-equal children.
     */
    public boolean contentEquals(N other)
    {
        if (other == null) return false;
        if (other == this) return true;
        if (getClass() != other.getClass()) return false;
        if (_child_count != other.size()) return false;
        if (!bodyEquals(other)) return false;
        for (int i = 0; i < _child_count; i++)
        {
            if (!get_child(i).contentEquals(other.get(i))) return false;
        }
        return true;
    }

    /**
     * Compares the node's own attributes, before {@link #contentEquals(Node)}
     * compares the children.  The default implementation returns true.
     */
    protected boolean bodyEquals(N other)
    {
        return true;
    }

    /**
     * Returns an indented rendering of this subtree, one node per line.
     */
    public String dump()
    {
        StringBuilder buf = new StringBuilder();
        dump(buf, "", "");
        return buf.toString();
    }

    private void dump(StringBuilder buf, String prefix, String childPrefix)
    {
        buf.append(prefix).append(this).append('\n');
        for (int i = 0; i < _child_count; i++)
        {
            boolean last = (i == _child_count - 1);
            Node<N> child = get_child(i);
            child.dump(buf,
                       childPrefix + (last ? "`-- " : "|-- "),
                       childPrefix + (last ? "    " : "|   "));
        }
    }


    //=========================================================================
    // Helpers for managing the children

    private static void checkIndex(int index, int limit)
    {
        if (index < 0 || index >= limit)
        {
            throw new IndexOutOfBoundsException(Integer.toString(index));
        }
    }

    private void validateNewChild(N child)
    {
        if (child == null)
        {
            throw new NullPointerException();
        }
        if (((Node<N>) child)._parent != null)
        {
            throw new AlreadyAttachedException();
        }
        if (isDescendantOrSelf(child))
        {
            throw new IllegalArgumentException(
                "a node can't be added to itself or its descendants");
        }
    }

    private void add_child(int index, N child)
    {
        if (_child_count == _children.length)
        {
            int next_size = (_children.length == 0) ? 4 : _children.length * 2;
            _children = Arrays.copyOf(_children, next_size);
        }
        if (index < _child_count)
        {
            System.arraycopy(_children, index, _children, index + 1,
                             _child_count - index);
        }
        _children[index] = child;
        _child_count++;
        ((Node<N>) child)._parent = this;
        patch_elements_helper(index);
    }

    private N remove_child(int index)
    {
        Node<N> child = get_child(index);
        int moved = _child_count - index - 1;
        if (moved > 0)
        {
            System.arraycopy(_children, index + 1, _children, index, moved);
        }
        _children[--_child_count] = null;
        child.detachFromParent();
        patch_elements_helper(index);
        return child.self();
    }

    private void patch_elements_helper(int from)
    {
        for (int i = from; i < _child_count; i++)
        {
            _children[i]._elementid = i;
        }
    }

    private void detachFromParent()
    {
        _parent = null;
        _elementid = -1;
    }


    /**
     * Iterates the children.  Removing the current child through the
     * iterator is allowed; changing this node in any other way while
     * iterating is detected if it displaces the current child.
     */
    private final class ChildIterator
        implements Iterator<N>
    {
        private int     __pos;
        private Node<N> __current;

        // Re-synchronizes the position when the current child was moved
        // by a mutation that did not go through this iterator.
        private void force_position_sync()
        {
            if (__current == null) return;
            if (__pos > 0 && __pos <= _child_count
                && _children[__pos - 1] == __current)
            {
                return;
            }
            if (__current._parent != Node.this)
            {
                throw new ConcurrentModificationException(
                    "current child has been removed from its parent");
            }
            __pos = __current._elementid + 1;
        }

        public boolean hasNext()
        {
            force_position_sync();
            return __pos < _child_count;
        }

        public N next()
        {
            force_position_sync();
            if (__pos >= _child_count)
            {
                throw new NoSuchElementException();
            }
            N child = get_child(__pos);
            __current = child;
            __pos++;
            return child;
        }

        public void remove()
        {
            if (__current == null)
            {
                throw new IllegalStateException();
            }
            force_position_sync();
            Node.this.remove(__pos - 1);
            __pos--;
            __current = null;
        }
    }


    /**
     * Lazy walk in (backward) document order, stepping through parent links
     * and child indices so no stack is needed.
     */
    private static final class Walk<N extends Node<N>>
        implements Iterable<N>
    {
        private final N       myStart;
        private final N       myUpto;
        private final boolean myEnterStart;
        private final boolean myReverse;

        Walk(N start, N upto, boolean enterStart, boolean reverse)
        {
            myStart = start;
            myUpto = upto;
            myEnterStart = enterStart;
            myReverse = reverse;
        }

        public Iterator<N> iterator()
        {
            return new Iterator<N>()
            {
                private N myNext = step(myStart, myEnterStart);

                public boolean hasNext()
                {
                    return myNext != null;
                }

                public N next()
                {
                    if (myNext == null) throw new NoSuchElementException();
                    N result = myNext;
                    myNext = step(result, true);
                    return result;
                }
            };
        }

        private N step(N from, boolean enter)
        {
            Node<N> node = from;
            if (enter && node._child_count > 0)
            {
                return node.get_child(myReverse ? node._child_count - 1 : 0);
            }
            while (node != myUpto)
            {
                Node<N> parent = node._parent;
                if (parent == null) return null;
                int index = node._elementid + (myReverse ? -1 : 1);
                if (index >= 0 && index < parent._child_count)
                {
                    return parent.get_child(index);
                }
                node = parent;
            }
            return null;
        }
    }


    private static final class FilterIterator<N>
        implements Iterator<N>
    {
        private final Iterator<N>          myIterator;
        private final Predicate<? super N> myPredicate;
        private N myNext;

        FilterIterator(Iterator<N> iterator, Predicate<? super N> predicate)
        {
            myIterator = iterator;
            myPredicate = predicate;
        }

        public boolean hasNext()
        {
            while (myNext == null && myIterator.hasNext())
            {
                N n = myIterator.next();
                if (myPredicate.test(n)) myNext = n;
            }
            return myNext != null;
        }

        public N next()
        {
            if (!hasNext()) throw new NoSuchElementException();
            N result = myNext;
            myNext = null;
            return result;
        }
    }
}

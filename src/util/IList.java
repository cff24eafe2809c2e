package util;

import exception.IRException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Intrusive doubly linked list. Each element carries its own {@link INode},
 * so an element knows the list (and through {@link #getVal()}, the owner)
 * it currently sits in, and can be used as an insertion anchor in O(1).
 *
 * @param <T> element type
 * @param <P> owner of the list
 */
public class IList<T, P> implements Iterable<IList.INode<T, P>> {
    private INode<T, P> entry; // Head of the list
    private INode<T, P> last;  // Tail of the list
    private final P val;       // Owner of the list
    private int numNode;       // Number of nodes in the list

    public IList(P val) {
        this.val = val;
        this.numNode = 0;
    }

    public P getVal() {
        return val;
    }

    public int getNumNode() {
        return numNode;
    }

    public boolean isEmpty() {
        return numNode == 0;
    }

    public INode<T, P> getEntry() {
        return entry;
    }

    public INode<T, P> getLast() {
        return last;
    }

    /** Snapshot of the element values in list order. */
    public List<T> values() {
        List<T> result = new ArrayList<>(numNode);
        for (INode<T, P> node : this) {
            result.add(node.getVal());
        }
        return result;
    }

    public Stream<INode<T, P>> stream() {
        return StreamSupport.stream(this.spliterator(), false);
    }

    @Override
    public Iterator<INode<T, P>> iterator() {
        return new IIterator(entry);
    }

    @Override
    public String toString() {
        return "IList (val: " + val + ", numNode: " + numNode + ") " + values();
    }

    private class IIterator implements Iterator<INode<T, P>> {
        private INode<T, P> next;

        IIterator(INode<T, P> head) {
            this.next = head;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public INode<T, P> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            INode<T, P> current = next;
            next = next.getNext();
            return current;
        }
    }

    /**
     * A node of the list, owned by the element it wraps.
     *
     * @param <T> The type of the value stored in the node.
     * @param <P> The type of the value associated with the parent list.
     */
    public static class INode<T, P> {
        private final T val;
        private INode<T, P> prev;
        private INode<T, P> next;
        private IList<T, P> parent;

        public INode(T t) {
            this.val = t;
        }

        public T getVal() {
            return val;
        }

        public IList<T, P> getParent() {
            return parent;
        }

        public INode<T, P> getPrev() {
            return prev;
        }

        public INode<T, P> getNext() {
            return next;
        }

        /**
         * Inserts this node at the end of the specified father list.
         *
         * @param father The IList to insert into.
         */
        public void insertAtEnd(IList<T, P> father) {
            if (father == null) {
                throw IRException.illegalOperand("father list cannot be null");
            }
            checkDetached();
            this.parent = father;
            this.prev = father.last;
            this.next = null;
            if (father.last == null) { // List is empty
                father.entry = this;
            } else {
                father.last.next = this;
            }
            father.last = this;
            father.numNode++;
        }

        /**
         * Inserts this node before the specified 'next' node.
         * This node's parent will be set to 'next' node's parent.
         *
         * @param next The node to insert before.
         */
        public void insertBefore(INode<T, P> next) {
            if (next == null || next.getParent() == null) {
                throw IRException.illegalOperand("next node and its parent cannot be null");
            }
            checkDetached();
            this.parent = next.parent;
            this.prev = next.prev;
            this.next = next;

            if (next.prev != null) {
                next.prev.next = this;
            } else { // 'next' was the entry node
                parent.entry = this;
            }
            next.prev = this;
            parent.numNode++;
        }

        private void checkDetached() {
            if (parent != null) {
                throw IRException.illegalOperand("node is already linked into a list");
            }
        }
    }
}

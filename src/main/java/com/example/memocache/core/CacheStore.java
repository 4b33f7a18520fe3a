package com.example.memocache.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key to entry storage ordered by recency (head = MRU, tail = LRU).
 * Never evicts on its own. Not thread-safe.
 */
public class CacheStore<K, V> {

    private static final class Node<K, V> {
        final K key;
        CacheEntry<K, V> entry;
        Node<K, V> prev;
        Node<K, V> next;

        Node(K key, CacheEntry<K, V> entry) {
            this.key = key;
            this.entry = entry;
        }
    }

    private final int capacity;

    // Key -> Node map for O(1) access
    private final Map<K, Node<K, V>> nodeMap = new HashMap<>();

    private Node<K, V> head;
    private Node<K, V> tail;

    public CacheStore(int capacity) {
        if (capacity <= 0) {
            throw new CacheConfigException("capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
    }

    /** Returns the entry without touching recency or checking expiry. */
    public Optional<CacheEntry<K, V>> get(K key) {
        Node<K, V> node = nodeMap.get(key);
        return node == null ? Optional.empty() : Optional.of(node.entry);
    }

    // May leave the store above capacity
    public void put(K key, CacheEntry<K, V> entry) {
        Node<K, V> node = nodeMap.get(key);
        if (node != null) {
            node.entry = entry;
            moveToHead(node);
            return;
        }
        node = new Node<>(key, entry);
        nodeMap.put(key, node);
        addToHead(node);
    }

    /** @return false if the key is absent */
    public boolean touch(K key) {
        Node<K, V> node = nodeMap.get(key);
        if (node == null) {
            return false;
        }
        moveToHead(node);
        return true;
    }

    public Optional<CacheEntry<K, V>> evictLru() {
        Node<K, V> victim = tail;
        if (victim == null) {
            return Optional.empty();
        }
        unlink(victim);
        nodeMap.remove(victim.key);
        return Optional.of(victim.entry);
    }

    public Optional<CacheEntry<K, V>> remove(K key) {
        Node<K, V> node = nodeMap.remove(key);
        if (node == null) {
            return Optional.empty();
        }
        unlink(node);
        return Optional.of(node.entry);
    }

    public void clear() {
        nodeMap.clear();
        head = null;
        tail = null;
    }

    public int size() {
        return nodeMap.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return nodeMap.isEmpty();
    }

    public List<K> keysMostRecentFirst() {
        List<K> keys = new ArrayList<>(nodeMap.size());
        for (Node<K, V> node = head; node != null; node = node.next) {
            keys.add(node.key);
        }
        return keys;
    }

    public List<CacheEntry<K, V>> entries() {
        List<CacheEntry<K, V>> entries = new ArrayList<>(nodeMap.size());
        for (Node<K, V> node = head; node != null; node = node.next) {
            entries.add(node.entry);
        }
        return entries;
    }

    // --- Doubly linked list operations ---

    private void moveToHead(Node<K, V> node) {
        if (node == head) {
            return;
        }
        unlink(node);
        addToHead(node);
    }

    private void addToHead(Node<K, V> node) {
        node.prev = null;
        node.next = head;
        if (head == null) {
            tail = node;
        } else {
            head.prev = node;
        }
        head = node;
    }

    private void unlink(Node<K, V> node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next;
        }

        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev;
        }
        node.prev = null;
        node.next = null;
    }
}

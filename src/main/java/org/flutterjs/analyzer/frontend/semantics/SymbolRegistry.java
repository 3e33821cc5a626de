package org.flutterjs.analyzer.frontend.semantics;

import org.flutterjs.analyzer.api.FileIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Project-wide table of declared types, keyed by simple name and indexed by declaring file.
 * <p>
 * Names are unique across the project: registering a name that another file already declared
 * replaces that entry (last writer wins). Files of the same batch register concurrently, so all
 * access goes through a read/write lock.
 */
public class SymbolRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolRegistry.class);

    private final Map<String, TypeDescriptor> byName = new HashMap<>();
    private final Map<FileIdentity, Set<String>> byFile = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Inserts or overwrites a descriptor by name and indexes it under its declaring file.
     *
     * @param descriptor The descriptor.
     */
    public void register(TypeDescriptor descriptor) {
        lock.writeLock().lock();
        try {
            put(descriptor);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Atomically replaces everything {@code file} declared with {@code descriptors}.
     *
     * @param file        The re-resolved file.
     * @param descriptors The file's current descriptors.
     */
    public void replaceFile(FileIdentity file, Collection<TypeDescriptor> descriptors) {
        lock.writeLock().lock();
        try {
            removeUnlocked(file);
            for (TypeDescriptor descriptor : descriptors) {
                put(descriptor);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void put(TypeDescriptor descriptor) {
        TypeDescriptor previous = byName.put(descriptor.name(), descriptor);
        if (previous != null && !previous.file().equals(descriptor.file())) {
            LOG.debug("Type {} declared in {} replaces the declaration in {}",
                    descriptor.name(), descriptor.file(), previous.file());
            Set<String> names = byFile.get(previous.file());
            if (names != null) {
                names.remove(descriptor.name());
                if (names.isEmpty()) byFile.remove(previous.file());
            }
        }
        byFile.computeIfAbsent(descriptor.file(), k -> new LinkedHashSet<>()).add(descriptor.name());
    }

    /**
     * Removes every descriptor declared by {@code file}. Must precede re-registration of a
     * changed file so that renamed or deleted types do not linger.
     *
     * @param file The file.
     */
    public void removeAllForFile(FileIdentity file) {
        lock.writeLock().lock();
        try {
            removeUnlocked(file);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void removeUnlocked(FileIdentity file) {
        Set<String> names = byFile.remove(file);
        if (names == null) return;
        for (String name : names) {
            TypeDescriptor current = byName.get(name);
            if (current != null && current.file().equals(file)) {
                byName.remove(name);
            }
        }
    }

    /**
     * @param name A simple type name.
     * @return The descriptor, if any file declares that name.
     */
    public Optional<TypeDescriptor> lookup(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byName.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Checks whether {@code name} is visible from {@code fromFile}: either declared there, or
     * declared in a file that one of its imports resolves to.
     *
     * @param name            The type name.
     * @param fromFile        The referencing file.
     * @param importsOfFile   The project files {@code fromFile} imports.
     * @return {@code true} if the type is available.
     */
    public boolean isAvailableIn(String name, FileIdentity fromFile, Collection<FileIdentity> importsOfFile) {
        Optional<TypeDescriptor> descriptor = lookup(name);
        if (descriptor.isEmpty()) return false;
        FileIdentity owner = descriptor.get().file();
        return owner.equals(fromFile) || importsOfFile.contains(owner);
    }

    /**
     * @param file A file.
     * @return {@code true} if the registry holds at least one descriptor declared by the file.
     */
    public boolean hasTypesFor(FileIdentity file) {
        lock.readLock().lock();
        try {
            return byFile.containsKey(file);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param file A file.
     * @return The descriptors declared by the file, in registration order.
     */
    public List<TypeDescriptor> typesInFile(FileIdentity file) {
        lock.readLock().lock();
        try {
            List<TypeDescriptor> result = new ArrayList<>();
            for (String name : byFile.getOrDefault(file, Set.of())) {
                TypeDescriptor descriptor = byName.get(name);
                if (descriptor != null) result.add(descriptor);
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return A snapshot of all descriptors.
     */
    public List<TypeDescriptor> allTypes() {
        lock.readLock().lock();
        try {
            return List.copyOf(byName.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return byName.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            byName.clear();
            byFile.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}

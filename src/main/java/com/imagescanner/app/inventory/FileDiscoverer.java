package com.imagescanner.app.inventory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Descoberta preguiçosa de arquivos candidatos.
 * <p>
 * Cada chamada a {@link #discover} começa um walk novo. Diretórios ilegíveis viram aviso
 * (e o walk segue); se a própria raiz some ou não pode ser lida a sequência termina vazia.
 * A ordem não é garantida.
 */
public class FileDiscoverer {

    private static final Logger logger = LoggerFactory.getLogger(FileDiscoverer.class);

    private final Consumer<String> warnings;
    private final LongAdder walkErrors;

    public FileDiscoverer() {
        this(msg -> {}, new LongAdder());
    }

    public FileDiscoverer(Consumer<String> warnings, LongAdder walkErrors) {
        this.warnings = warnings;
        this.walkErrors = walkErrors;
    }

    /**
     * Extensões viram ".ext" em minúsculas; "JPG", ".jpg" e ".JPG" são equivalentes.
     */
    public static Set<String> normalizeExtensions(Collection<String> extensions) {
        Set<String> out = new LinkedHashSet<>();
        if (extensions == null) return out;
        for (String e : extensions) {
            if (e == null || e.isBlank()) continue;
            String norm = e.trim().toLowerCase(Locale.ROOT);
            out.add(norm.startsWith(".") ? norm : "." + norm);
        }
        return out;
    }

    static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) return "";
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return dot < 0 ? "" : s.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * O stream precisa ser fechado (libera o DirectoryStream aberto).
     */
    public Stream<Path> discover(Path root, Collection<String> extensions, boolean recursive, CancellationToken cancel) {
        var walker = new Walker(root.toAbsolutePath().normalize(), normalizeExtensions(extensions), recursive, cancel);
        var spliterator = Spliterators.spliteratorUnknownSize(walker, Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(walker::close);
    }

    private void warn(String msg, Exception e) {
        walkErrors.increment();
        logger.warn("{}: {}", msg, e.toString());
        warnings.accept(msg);
    }

    private final class Walker implements Iterator<Path>, AutoCloseable {
        private final Path root;
        private final Set<String> extensions;
        private final boolean recursive;
        private final CancellationToken cancel;

        private final Deque<Path> pendingDirs = new ArrayDeque<>();
        private DirectoryStream<Path> current;
        private Iterator<Path> entries;
        private Path next;
        private boolean done;

        Walker(Path root, Set<String> extensions, boolean recursive, CancellationToken cancel) {
            this.root = root;
            this.extensions = extensions;
            this.recursive = recursive;
            this.cancel = cancel;
            pendingDirs.push(root);
        }

        @Override
        public boolean hasNext() {
            if (done) return false;
            if (cancel.isCancellationRequested()) {
                finish();
                return false;
            }
            if (next == null) next = advance();
            return next != null;
        }

        @Override
        public Path next() {
            if (!hasNext()) throw new NoSuchElementException();
            Path p = next;
            next = null;
            return p;
        }

        private Path advance() {
            while (!cancel.isCancellationRequested()) {
                if (entries == null) {
                    if (!openNextDirectory()) {
                        finish();
                        return null;
                    }
                    continue;
                }

                Path entry;
                try {
                    if (!entries.hasNext()) {
                        closeCurrent();
                        continue;
                    }
                    entry = entries.next();
                } catch (DirectoryIteratorException e) {
                    // diretório sumiu durante a listagem
                    warn("Falha ao listar diretório", e);
                    closeCurrent();
                    if (rootVanished()) break;
                    continue;
                }

                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    if (recursive) pendingDirs.push(entry);
                    continue;
                }
                if (Files.isRegularFile(entry) && extensions.contains(extensionOf(entry))) {
                    return entry;
                }
            }
            finish();
            return null;
        }

        private boolean openNextDirectory() {
            while (!pendingDirs.isEmpty()) {
                Path dir = pendingDirs.pop();
                try {
                    current = Files.newDirectoryStream(dir);
                    entries = current.iterator();
                    return true;
                } catch (IOException | UncheckedIOException e) {
                    if (dir.equals(root) || rootVanished()) {
                        warn("Raiz inacessível: " + root, e);
                        return false;
                    }
                    warn("Diretório inacessível: " + dir, e);
                }
            }
            return false;
        }

        private boolean rootVanished() {
            return !Files.isDirectory(root);
        }

        private void closeCurrent() {
            if (current != null) {
                try {
                    current.close();
                } catch (IOException e) {
                    logger.debug("Falha ao fechar DirectoryStream", e);
                }
            }
            current = null;
            entries = null;
        }

        private void finish() {
            done = true;
            next = null;
            pendingDirs.clear();
            closeCurrent();
        }

        @Override
        public void close() {
            finish();
        }
    }
}

package com.flinspect.core.parse_tree;

import com.flinspect.core.model.Diagnostic;
import com.flinspect.core.model.DiagnosticKind;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * Streams a parse-tree dump and yields one generic tree per top-level construct.
 *
 * Nesting is given by the number of leading {@code |} markers. Each call to {@link #open()}
 * reopens the file, so a reader can be walked any number of times. Inconsistent nesting never
 * aborts the walk: the offending fragment is skipped and reported to the diagnostic sink.
 *
 * A cursor closes its file when it reaches the end; one abandoned earlier must be closed by the
 * caller. The plain {@link #iterator()} leaves that to exhaustion.
 */
public class ParseTreeReader implements Iterable<PtNode> {

    public static class MalformedTreeException extends RuntimeException {
        public MalformedTreeException(String message) { super(message); }
        public MalformedTreeException(String message, Throwable cause) { super(message, cause); }
    }

    public static class ParseTreeReadException extends RuntimeException {
        public ParseTreeReadException(String message) { super(message); }
        public ParseTreeReadException(String message, Throwable cause) { super(message, cause); }
    }

    private final Path dumpFile;
    private final String fileKey;
    private final Consumer<Diagnostic> diagnostics;

    public ParseTreeReader(Path dumpFile) {
        this(dumpFile, d -> {});
    }

    public ParseTreeReader(Path dumpFile, Consumer<Diagnostic> diagnostics) {
        this.dumpFile = dumpFile;
        this.fileKey = dumpFile.getFileName().toString();
        this.diagnostics = diagnostics;
    }

    public Path dumpFile() { return dumpFile; }

    /** File name of the dump, used to tag locations and file-local ids. */
    public String fileKey() { return fileKey; }

    /**
     * @throws ParseTreeReadException if the dump cannot be opened
     */
    public TreeCursor open() {
        if (!Files.isRegularFile(dumpFile)) {
            throw new ParseTreeReadException("Parse-tree dump not found: " + dumpFile);
        }
        try {
            return new TreeCursor(Files.newBufferedReader(dumpFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ParseTreeReadException("Failed to open parse-tree dump: " + dumpFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Iterator<PtNode> iterator() {
        return open();
    }

    /** Reads every top-level construct eagerly. */
    public List<PtNode> readAll() {
        List<PtNode> roots = new ArrayList<>();
        try (TreeCursor trees = open()) {
            while (trees.hasNext()) {
                roots.add(trees.next());
            }
        }
        return roots;
    }

    /** Iterator over the top-level constructs of one open dump. Closing is idempotent. */
    public final class TreeCursor implements Iterator<PtNode>, Closeable {

        private final BufferedReader reader;
        // open.get(d) is the innermost node open at depth d
        private final List<PtNode> open = new ArrayList<>();
        private PtNode current;
        private PtNode ready;
        private boolean done;
        private int lineNo;
        private int skipDeeperThan = -1;
        private boolean closed;

        TreeCursor(BufferedReader reader) {
            this.reader = reader;
        }

        /** Stops the walk; later calls to {@link #hasNext()} return false. */
        @Override
        public void close() {
            done = true;
            ready = null;
            current = null;
            if (closed) return;
            closed = true;
            try {
                reader.close();
            } catch (IOException e) {
                throw new ParseTreeReadException("Failed to close parse-tree dump: " + dumpFile, e);
            }
        }

        @Override
        public boolean hasNext() {
            advance();
            return ready != null;
        }

        @Override
        public PtNode next() {
            advance();
            if (ready == null) throw new NoSuchElementException();
            PtNode result = ready;
            ready = null;
            return result;
        }

        private void advance() {
            while (ready == null && !done) {
                String raw = readLine();
                if (raw == null) {
                    finish();
                    return;
                }
                lineNo++;
                DumpLine line = DumpLine.parse(raw, lineNo);
                if (line == null) continue;
                if (skipDeeperThan >= 0) {
                    if (line.depth() > skipDeeperThan) continue;
                    skipDeeperThan = -1;
                }
                try {
                    accept(line);
                } catch (MalformedTreeException e) {
                    skipDeeperThan = open.size();
                    Diagnostic d = new Diagnostic(DiagnosticKind.MALFORMED_TREE, fileKey, line.line(), null, e.getMessage());
                    System.err.println("[flinspect] WARNING: " + d);
                    diagnostics.accept(d);
                }
            }
        }

        private void accept(DumpLine line) {
            int depth = line.depth();
            if (depth == 0) {
                PtNode finished = current;
                open.clear();
                current = attachChain(null, line);
                if (finished != null) ready = finished;
                return;
            }
            if (current == null) {
                throw new MalformedTreeException("Construct at depth " + depth + " before any top-level construct");
            }
            if (depth > open.size()) {
                throw new MalformedTreeException("Nesting jumps from depth " + (open.size() - 1) + " to " + depth);
            }
            while (open.size() > depth) {
                open.remove(open.size() - 1);
            }
            attachChain(open.get(depth - 1), line);
        }

        /** Builds the chain of a line under {@code parent}, records its tail as open, returns its head. */
        private PtNode attachChain(PtNode parent, DumpLine line) {
            PtNode head = null;
            PtNode tail = parent;
            for (DumpLine.Segment seg : line.chain()) {
                PtNode node = new PtNode(seg.label(), seg.value(), line.line());
                if (tail != null) tail.addChild(node);
                if (head == null) head = node;
                tail = node;
            }
            open.add(tail);
            return head;
        }

        private void finish() {
            PtNode last = current;
            close();
            ready = last;
        }

        private String readLine() {
            try {
                return reader.readLine();
            } catch (IOException e) {
                ParseTreeReadException failure = new ParseTreeReadException(
                        "Failed to read parse-tree dump: " + dumpFile + " at line " + lineNo, e);
                try {
                    close();
                } catch (ParseTreeReadException closeFailure) {
                    failure.addSuppressed(closeFailure);
                }
                throw failure;
            }
        }
    }
}

package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Abstract strategy for turning one kind of feature document into a typed
 * record.
 *
 * <p>Each document convention (specification, task list, data model,
 * plan, research notes) has its own subclass. This class provides the
 * template method {@link #parse(Path)}, which reads the file and hands its
 * content to {@link #parseContent(String)}.</p>
 *
 * <p>Subclasses never throw for readable text: sections that are missing
 * or malformed leave the corresponding fields at their defaults. Only the
 * file read can fail.</p>
 *
 * @param <T> the record type produced by the parser
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class DocumentParser<T> {

    private static final Logger LOG = LoggerFactory.getLogger(
            DocumentParser.class);

    /**
     * Returns the base name of the files this parser understands.
     *
     * @return the file name, e.g. {@code tasks.md}
     */
    public abstract String fileName();

    /**
     * Parses document content.
     *
     * @param content the document text, never null
     * @return the parsed record, never null
     */
    public abstract T parseContent(String content);

    /**
     * Reads and parses a document.
     *
     * @param file the document to read
     * @return the parsed record
     * @throws IOException if the file cannot be read
     */
    public T parse(final Path file) throws IOException {
        Preconditions.requireNonNull(file, "File is required");
        final String content = Files.readString(file, StandardCharsets.UTF_8);
        LOG.debug("Parsing {} ({} chars)", file, content.length());
        return parseContent(content);
    }

    /**
     * Checks whether this parser handles the given file.
     *
     * @param file the file to check
     * @return true if the file's base name is {@link #fileName()}
     */
    public boolean accepts(final Path file) {
        return file != null && file.getFileName() != null
                && fileName().equals(file.getFileName().toString());
    }

}

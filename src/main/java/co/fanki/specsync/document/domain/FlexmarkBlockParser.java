package co.fanki.specsync.document.domain;

import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlEntity;
import com.vladsch.flexmark.ast.HtmlInline;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.ListBlock;
import com.vladsch.flexmark.ast.ListItem;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.ext.tables.TableCell;
import com.vladsch.flexmark.ext.tables.TableRow;
import com.vladsch.flexmark.ext.tables.TableSeparator;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.ext.yaml.front.matter.YamlFrontMatterBlock;
import com.vladsch.flexmark.ext.yaml.front.matter.YamlFrontMatterExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.DelimitedNode;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link BlockParser} backed by flexmark, with GFM tables and YAML front
 * matter enabled.
 *
 * <p>Front matter is dropped; every other top-level node becomes one
 * {@link Block}. Parsing is synchronous and the parser instance is
 * thread safe, so one instance is shared by all format parsers.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class FlexmarkBlockParser implements BlockParser {

    private final Parser parser;

    /** Creates a new FlexmarkBlockParser. */
    public FlexmarkBlockParser() {
        final MutableDataSet options = new MutableDataSet();
        options.set(Parser.EXTENSIONS, List.of(
                TablesExtension.create(),
                YamlFrontMatterExtension.create()));
        this.parser = Parser.builder(options).build();
    }

    @Override
    public List<Block> parse(final String text) {
        final Node document = parser.parse(text == null ? "" : text);
        final List<Block> blocks = new ArrayList<>();

        Node node = document.getFirstChild();
        while (node != null) {
            final Block block = toBlock(node);
            if (block != null) {
                blocks.add(block);
            }
            node = node.getNext();
        }
        return blocks;
    }

    private Block toBlock(final Node node) {
        final String source = node.getChars().toString();

        if (node instanceof YamlFrontMatterBlock) {
            return null;
        }
        if (node instanceof Heading heading) {
            return Block.heading(heading.getLevel(), source,
                    () -> flatten(heading));
        }
        if (node instanceof Paragraph) {
            return Block.paragraph(source, () -> flatten(node));
        }
        if (node instanceof ListBlock list) {
            return Block.list(source, entries(list));
        }
        if (node instanceof TableBlock table) {
            return Block.table(source, rows(table));
        }
        if (node instanceof FencedCodeBlock fenced) {
            return Block.code(source, fenced.getInfo().toString().trim(),
                    stripTrailingNewline(fenced.getContentChars().toString()));
        }
        if (node instanceof IndentedCodeBlock indented) {
            return Block.code(source, null,
                    stripTrailingNewline(indented.getContentChars().toString()));
        }
        return Block.other(source, () -> flatten(node));
    }

    private List<ListEntry> entries(final ListBlock list) {
        final List<ListEntry> entries = new ArrayList<>();
        for (final Node child : list.getChildren()) {
            if (child instanceof ListItem item) {
                entries.add(entry(item));
            }
        }
        return entries;
    }

    private ListEntry entry(final ListItem item) {
        final StringBuilder text = new StringBuilder();
        final StringBuilder source = new StringBuilder();
        final List<ListEntry> children = new ArrayList<>();

        for (final Node child : item.getChildren()) {
            if (child instanceof ListBlock nested) {
                children.addAll(entries(nested));
                continue;
            }
            if (text.length() > 0) {
                text.append('\n');
                source.append('\n');
            }
            text.append(flatten(child));
            source.append(child.getChars().toString().trim());
        }
        return new ListEntry(text.toString(), source.toString(), children);
    }

    private List<List<String>> rows(final TableBlock table) {
        final List<List<String>> rows = new ArrayList<>();
        for (final Node section : table.getChildren()) {
            if (section instanceof TableSeparator) {
                continue;
            }
            for (final Node row : section.getChildren()) {
                if (row instanceof TableRow) {
                    final List<String> cells = new ArrayList<>();
                    for (final Node cell : row.getChildren()) {
                        if (cell instanceof TableCell) {
                            cells.add(flatten(cell).trim());
                        }
                    }
                    rows.add(cells);
                }
            }
        }
        return rows;
    }

    /**
     * Concatenates all leaf text under a node, dropping inline markup.
     *
     * @param node the node to flatten
     * @return the plain text
     */
    static String flatten(final Node node) {
        final StringBuilder out = new StringBuilder();
        append(node, out);
        return out.toString();
    }

    private static void append(final Node node, final StringBuilder out) {
        if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
            out.append('\n');
            return;
        }
        if (!node.hasChildren()) {
            if (node instanceof Text || node instanceof HtmlInline
                    || node instanceof HtmlEntity) {
                out.append(node.getChars());
            } else if (node instanceof DelimitedNode delimited) {
                out.append(delimited.getText());
            }
            return;
        }
        for (final Node child : node.getChildren()) {
            if (child instanceof com.vladsch.flexmark.util.ast.Block
                    && out.length() > 0
                    && out.charAt(out.length() - 1) != '\n') {
                out.append('\n');
            }
            append(child, out);
        }
    }

    private static String stripTrailingNewline(final String content) {
        if (content.endsWith("\n")) {
            return content.substring(0, content.length() - 1);
        }
        return content;
    }

}

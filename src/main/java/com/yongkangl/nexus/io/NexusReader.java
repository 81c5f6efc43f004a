package com.yongkangl.nexus.io;

import com.yongkangl.nexus.model.NexusDocument;
import com.yongkangl.nexus.model.NodeBuilder;
import com.yongkangl.nexus.model.Rooting;
import com.yongkangl.nexus.model.TaxonRegistry;
import com.yongkangl.nexus.model.TranslateTable;
import com.yongkangl.nexus.model.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads NEXUS documents with TAXA and TREES blocks, and bare Newick strings, into an immutable
 * {@link NexusDocument}. Other blocks are skipped. The first problem found aborts the whole read with
 * a {@link NexusException}; no partial document is ever returned.
 *
 * <p>A reader keeps only its configuration, so one instance may serve any number of threads.
 */
public class NexusReader {
    private static final Logger log = LoggerFactory.getLogger(NexusReader.class);

    private final ReaderConfig config;

    public NexusReader() {
        this(ReaderConfig.defaults());
    }

    public NexusReader(ReaderConfig config) {
        this.config = config;
    }

    public ReaderConfig getConfig() {
        return config;
    }

    /**
     * Reads the whole stream as UTF-8. The stream is left open.
     */
    public NexusDocument read(InputStream in) throws IOException {
        return read(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    // The reader is consumed but not closed.
    public NexusDocument read(Reader in) throws IOException {
        return read(slurp(in));
    }

    public NexusDocument read(String text) {
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        NexusTokenizer tokenizer = new NexusTokenizer(text, config.isPreserveUnderscores());
        CommandReader reader = new CommandReader(tokenizer);
        Token header = tokenizer.next();
        if (!header.is(Token.Type.HEADER)) {
            throw new NexusSyntaxException("Document does not start with #NEXUS", header.getPosition());
        }

        TaxonResolver taxa = TaxonResolver.implicit(config.isCaseSensitiveTaxonLabels());
        List<TranslateTable> translateTables = new ArrayList<>();
        List<Tree> trees = new ArrayList<>();
        while (true) {
            Token begin = reader.nextCommand();
            if (begin.is(Token.Type.EOF)) {
                break;
            }
            if (!begin.isKeyword("BEGIN")) {
                throw new NexusSyntaxException("Expected BEGIN but found " + begin.describe(), begin.getPosition());
            }
            Token name = tokenizer.next();
            if (!name.is(Token.Type.WORD)) {
                throw new NexusSyntaxException("BEGIN must be followed by a block name, found " + name.describe(),
                        name.getPosition());
            }
            reader.expect(Token.Type.SEMICOLON, "';' after BEGIN " + name.getText());

            if (name.isKeyword("TAXA")) {
                if (taxa.isDeclared()) {
                    throw new NexusValidationException("Document has more than one TAXA block", name.getPosition());
                }
                if (!taxa.isEmpty()) {
                    throw new NexusValidationException("TAXA block must precede the TREES blocks", name.getPosition());
                }
                TaxonRegistry registry = new TaxaBlockParser(reader, config.isCaseSensitiveTaxonLabels()).parse(name);
                log.debug("Read {} taxa", registry.size());
                taxa = TaxonResolver.declared(registry);
            } else if (name.isKeyword("TREES")) {
                TreesBlockParser block = new TreesBlockParser(reader, taxa, config);
                block.parse(name);
                if (block.hasTranslate()) {
                    translateTables.add(block.getTranslate());
                }
                trees.addAll(block.getTrees());
                log.debug("Read {} trees from block at {}", block.getTrees().size(), name.getPosition());
            } else {
                reader.skipBlock(name);
            }
        }
        return new NexusDocument(taxa.registry(), taxa.isDeclared(), translateTables, trees);
    }

    /**
     * Reads one or more semicolon-terminated Newick trees without a NEXUS wrapper. Leading
     * {@code [&R]}/{@code [&U]} comments set the rooting. The final semicolon may be omitted.
     */
    public NexusDocument readNewick(String text) {
        String trimmed = text.trim();
        if (!trimmed.isEmpty() && !trimmed.endsWith(";")) {
            trimmed = trimmed + ";";
        }
        NexusTokenizer tokenizer = new NexusTokenizer(trimmed, config.isPreserveUnderscores());
        TaxonResolver taxa = TaxonResolver.implicit(config.isCaseSensitiveTaxonLabels());
        List<Tree> trees = new ArrayList<>();
        while (tokenizer.hasNext()) {
            TreeCommands commands = new TreeCommands(Rooting.UNSPECIFIED);
            commands.read(tokenizer, config.isStoreTreeWeights());
            NewickParser newick = new NewickParser(tokenizer, taxa, TranslateTable.EMPTY, config.getMaxTreeDepth());
            NodeBuilder root = newick.parseTree();
            Rooting rooting = config.getRootingInterpretation().apply(commands.getRooting());
            trees.add(new Tree(null, rooting, commands.getWeight(), commands.getAnnotations(), root));
        }
        if (trees.isEmpty()) {
            throw new NexusSyntaxException("No Newick tree found", new SourcePosition(1, 1, 0));
        }
        return new NexusDocument(taxa.registry(), false, new ArrayList<>(), trees);
    }

    // Reads to the end without closing; the caller owns the reader.
    private static String slurp(Reader in) throws IOException {
        StringBuilder sb = new StringBuilder();
        BufferedReader br = new BufferedReader(in);
        char[] buffer = new char[8192];
        int read;
        while ((read = br.read(buffer)) != -1) {
            sb.append(buffer, 0, read);
        }
        return sb.toString();
    }
}

package com.yongkangl.nexus.io;

import com.yongkangl.nexus.model.NodeBuilder;
import com.yongkangl.nexus.model.Rooting;
import com.yongkangl.nexus.model.TranslateTable;
import com.yongkangl.nexus.model.Tree;

import java.util.ArrayList;
import java.util.List;

// Reads the body of a TREES block: an optional TRANSLATE command and any number of TREE statements.
class TreesBlockParser {
    private final CommandReader reader;
    private final TaxonResolver taxa;
    private final ReaderConfig config;
    private TranslateTable translate = TranslateTable.EMPTY;
    private boolean translateSeen;
    private final List<Tree> trees = new ArrayList<>();

    TreesBlockParser(CommandReader reader, TaxonResolver taxa, ReaderConfig config) {
        this.reader = reader;
        this.taxa = taxa;
        this.config = config;
    }

    void parse(Token blockName) {
        while (true) {
            Token command = reader.nextCommand();
            if (command.is(Token.Type.EOF)) {
                throw CommandReader.missingEnd(blockName);
            }
            if (CommandReader.isBlockEnd(command)) {
                reader.expect(Token.Type.SEMICOLON, "';' after " + command.getText());
                return;
            }
            if (command.isKeyword("TRANSLATE")) {
                if (translateSeen) {
                    throw new NexusValidationException("TREES block has more than one TRANSLATE command",
                            command.getPosition());
                }
                if (!trees.isEmpty()) {
                    throw new NexusSyntaxException("TRANSLATE must precede the TREE statements", command.getPosition());
                }
                translate = new TranslateTableParser(reader, taxa).parse(command);
                translateSeen = true;
            } else if (command.isKeyword("TREE") || command.isKeyword("UTREE")) {
                trees.add(parseTree(command));
            } else {
                reader.skipCommand(command);
            }
        }
    }

    private Tree parseTree(Token command) {
        Token name = reader.next();
        if (name.is(Token.Type.STAR)) {
            name = reader.next();
        }
        if (!name.isLabel()) {
            throw new NexusSyntaxException("Expected a tree name but found " + name.describe(), name.getPosition());
        }
        reader.expect(Token.Type.EQUALS, "'=' after tree name " + name.getText());

        Rooting stated = command.isKeyword("UTREE") ? Rooting.UNROOTED : Rooting.UNSPECIFIED;
        TreeCommands commands = new TreeCommands(stated);
        commands.read(reader.tokenizer(), config.isStoreTreeWeights());

        NewickParser newick = new NewickParser(reader.tokenizer(), taxa, translate, config.getMaxTreeDepth());
        NodeBuilder root = newick.parseTree();
        Rooting rooting = config.getRootingInterpretation().apply(commands.getRooting());
        return new Tree(name.getText(), rooting, commands.getWeight(), commands.getAnnotations(), root);
    }

    boolean hasTranslate() {
        return translateSeen;
    }

    TranslateTable getTranslate() {
        return translate;
    }

    List<Tree> getTrees() {
        return trees;
    }
}

package com.yongkangl.nexus.io;

import com.yongkangl.nexus.model.NexusDocument;
import com.yongkangl.nexus.model.NodeBuilder;
import com.yongkangl.nexus.model.Rooting;
import com.yongkangl.nexus.model.TopologyEnumerator;
import com.yongkangl.nexus.model.Tree;
import com.yongkangl.nexus.model.TreeComparator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WriterRoundTripTest {

    private static final double TOLERANCE = 1e-12;

    private final NexusReader reader = new NexusReader();
    private final TreeComparator comparator = new TreeComparator(TOLERANCE);

    @Nested
    @DisplayName("Newick writer")
    class Newick {

        @Test
        void birdOrdersRoundTrip() {
            Tree tree = reader.read(Fixtures.birdOrders()).getTree(0);
            String newick = new NewickWriter().write(tree);
            assertThat(newick).startsWith("[&R] ((Struthioniformes:21.8,Tinamiformes:21.8):4.1,");

            Tree reread = reader.readNewick(newick).getTree(0);
            assertThat(comparator.equivalent(tree, reread)).isTrue();
        }

        @Test
        void translateKeysReproduceTheFixtureTreeString() {
            NexusDocument document = reader.read(Fixtures.birdOrders());
            String newick = new NewickWriter().setTranslate(document.getTranslateTable()).write(document.getTree(0));
            assertThat(Fixtures.birdOrders()).contains("TREE * UNTITLED = " + newick);
        }

        @Test
        void labelsThatNeedItAreQuoted() {
            assertThat(NewickWriter.quote("Passeriformes")).isEqualTo("Passeriformes");
            assertThat(NewickWriter.quote("Homo sapiens")).isEqualTo("'Homo sapiens'");
            assertThat(NewickWriter.quote("it's")).isEqualTo("'it''s'");
            assertThat(NewickWriter.quote("a:b")).isEqualTo("'a:b'");
            assertThat(NewickWriter.quote("")).isEqualTo("''");
            assertThat(NewickWriter.quote("Homo_sapiens")).isEqualTo("'Homo_sapiens'");

            Tree tree = reader.readNewick("('Homo sapiens':1,'it''s (odd)':2);").getTree(0);
            String newick = new NewickWriter().write(tree);
            assertThat(newick).isEqualTo("('Homo sapiens':1,'it''s (odd)':2);");
            assertThat(comparator.equivalent(tree, reader.readNewick(newick).getTree(0))).isTrue();
        }

        @Test
        void quotedUnderscoresSurviveAReaderThatConvertsThem() {
            ReaderConfig config = new ReaderConfig();
            config.setPreserveUnderscores(false);
            NexusReader converting = new NexusReader(config);
            Tree tree = converting.readNewick("('Pan_paniscus':1,Homo_sapiens:2);").getTree(0);
            assertThat(tree.getRoot().getChild(0).getTaxonName()).isEqualTo("Pan_paniscus");
            assertThat(tree.getRoot().getChild(1).getTaxonName()).isEqualTo("Homo sapiens");

            String newick = new NewickWriter().write(tree);
            assertThat(newick).isEqualTo("('Pan_paniscus':1,'Homo sapiens':2);");
            Tree reread = converting.readNewick(newick).getTree(0);
            assertThat(reread.getRoot().getChild(0).getTaxonName()).isEqualTo("Pan_paniscus");
            assertThat(comparator.equivalent(tree, reread)).isTrue();
        }

        @Test
        void branchLengthFormatting() {
            assertThat(NewickWriter.formatLength(21.8)).isEqualTo("21.8");
            assertThat(NewickWriter.formatLength(1.0)).isEqualTo("1");
            assertThat(NewickWriter.formatLength(-2.0)).isEqualTo("-2");
            assertThat(NewickWriter.formatLength(1e-7)).isEqualTo("1.0E-7");
            assertThat(reader.readNewick("(A:1.0E-7,B:3);").getTree(0).findLeaf("A")
                    .getBranchLength().getAsDouble()).isEqualTo(1e-7);
        }

        @Test
        void optionalPartsCanBeLeftOut() {
            Tree tree = reader.readNewick("[&U] ((A:1,B:2)90:0.5[&rate=2],C:3);").getTree(0);
            assertThat(new NewickWriter().write(tree)).isEqualTo("[&U] ((A:1,B:2)90:0.5,C:3);");
            assertThat(new NewickWriter().setWriteAnnotations(true).write(tree))
                    .isEqualTo("[&U] ((A:1,B:2)90:0.5[&rate=2],C:3);");
            assertThat(new NewickWriter().setWriteBranchLengths(false).setWriteInternalLabels(false)
                    .setWriteRooting(false).write(tree)).isEqualTo("((A,B),C);");
            assertThat(new NewickWriter().write(tree.getRoot().getChild(0))).isEqualTo("(A:1,B:2)90:0.5");
        }

        @Test
        void missingTranslateKeyIsRejected() {
            NexusDocument document = reader.read(Fixtures.birdOrders());
            Tree other = reader.readNewick("(Struthioniformes,Dodo);").getTree(0);
            NewickWriter writer = new NewickWriter().setTranslate(document.getTranslateTable());
            assertThatThrownBy(() -> writer.write(other))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Dodo");
        }

        @Test
        void everyRootedTopologyOfFiveTaxaRoundTrips() {
            List<NodeBuilder> topologies = new TopologyEnumerator(Arrays.asList("A", "B", "C", "D", "E")).enumerate();
            assertThat(topologies).hasSize(105);
            NewickWriter writer = new NewickWriter();
            for (NodeBuilder topology : topologies) {
                Tree tree = new Tree(null, Rooting.ROOTED, topology);
                Tree reread = reader.readNewick(writer.write(tree)).getTree(0);
                assertThat(comparator.equivalent(tree, reread)).as(writer.write(tree)).isTrue();
            }
        }
    }

    @Nested
    @DisplayName("NEXUS writer")
    class Nexus {

        @Test
        void birdOrdersDocumentRoundTrip() {
            NexusDocument document = reader.read(Fixtures.birdOrders());
            String text = new NexusWriter().write(document);
            assertThat(text).startsWith("#NEXUS\n").contains("DIMENSIONS NTAX = 23;").contains("TREE UNTITLED = [&R] ");

            NexusDocument reread = reader.read(text);
            assertThat(reread.getTaxa().getNames()).isEqualTo(document.getTaxa().getNames());
            assertThat(reread.getTranslateTable().asMap()).isEqualTo(document.getTranslateTable().asMap());
            assertThat(reread.getTree("UNTITLED")).isNotNull();
            assertThat(comparator.equivalent(document.getTree(0), reread.getTree(0))).isTrue();
        }

        @Test
        void weightsNamesAndQuotedTaxaSurvive() {
            NexusDocument document = reader.read("#NEXUS\n"
                    + "BEGIN TAXA; DIMENSIONS NTAX=3; TAXLABELS 'Homo sapiens' Pan Gorilla; END;\n"
                    + "BEGIN TREES; TREE 'ml tree' = [&W 0.5] [&U] ('Homo sapiens':1,Pan:1,Gorilla:2); END;\n");
            NexusDocument reread = reader.read(new NexusWriter().write(document));
            Tree tree = reread.getTree("ml tree");
            assertThat(tree.getWeight()).isEqualTo(0.5);
            assertThat(tree.getRooting()).isEqualTo(Rooting.UNROOTED);
            assertThat(reread.getTaxa().getNames()).containsExactly("Homo sapiens", "Pan", "Gorilla");
            assertThat(comparator.equivalent(document.getTree(0), tree)).isTrue();
        }

        @Test
        void literalLeavesWhenTranslateIsOff() {
            NexusDocument document = reader.readNewick("(A:1,(B:2,C:3):4);");
            String text = new NexusWriter().setUseTranslate(false).write(document);
            assertThat(text).doesNotContain("TRANSLATE").contains("TREE tree1 = (A:1,(B:2,C:3):4);");
            assertThat(comparator.equivalent(document.getTree(0), reader.read(text).getTree(0))).isTrue();
        }
    }
}

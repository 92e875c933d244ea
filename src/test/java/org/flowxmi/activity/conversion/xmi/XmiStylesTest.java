package org.flowxmi.activity.conversion.xmi;

import org.flowxmi.activity.conversion.config.ConfigHelper;
import org.flowxmi.activity.conversion.config.models.ConverterConfig;
import org.flowxmi.activity.conversion.graph.models.ActionNode;
import org.flowxmi.activity.conversion.graph.models.DecisionNode;
import org.flowxmi.activity.conversion.graph.models.NodeKind;
import org.flowxmi.activity.conversion.repair.BranchClassifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XmiStylesTest {
    private final BranchClassifier classifier = new BranchClassifier(List.of("approve"), List.of("reject"));

    @Test
    void shouldConvertHexColorsToBgr() {
        assertEquals(255, XmiStyles.parseColor("#FF0000"));
        assertEquals(16711680, XmiStyles.parseColor("#0000ff"));
        assertNull(XmiStyles.parseColor("#12345"));
        assertNull(XmiStyles.parseColor("#GGGGGG"));
    }

    @Test
    void shouldResolveNamedColors() {
        assertEquals(8454143, XmiStyles.parseColor("Green"));
        assertEquals(5263615, XmiStyles.parseColor(" red "));
        assertNull(XmiStyles.parseColor("mauve"));
        assertNull(XmiStyles.parseColor(null));
    }

    @Test
    void shouldColorActionsByTagThenByLabel() {
        ActionNode tagged = ActionNode.builder().id("a").label("Reject claim").color("#00FF00").build();
        ActionNode success = ActionNode.builder().id("b").label("Approve claim").build();
        ActionNode failure = ActionNode.builder().id("c").label("Reject claim").build();
        ActionNode plain = ActionNode.builder().id("d").label("Archive").build();

        assertEquals(65280, XmiStyles.actionColor(tagged, classifier));
        assertEquals(8454143, XmiStyles.actionColor(success, classifier));
        assertEquals(5263615, XmiStyles.actionColor(failure, classifier));
        assertEquals(13434828, XmiStyles.actionColor(plain, classifier));
        assertEquals(13434828, XmiStyles.actionColor(success, null));
    }

    @Test
    void shouldLeaveValidateActionUncoloredWithDefaultKeywords() {
        ConverterConfig config = ConfigHelper.loadDefaultConfig();
        BranchClassifier defaults = new BranchClassifier(config.repair.successKeywords, config.repair.failureKeywords);

        assertEquals(13434828, XmiStyles.actionColor(ActionNode.builder().id("v").label("Validate").build(), defaults));
        assertEquals(8454143, XmiStyles.actionColor(ActionNode.builder().id("w").label("Data valid").build(), defaults));
        assertEquals(5263615, XmiStyles.actionColor(ActionNode.builder().id("x").label("Invalid data").build(), defaults));
    }

    @Test
    void shouldMapKindsToEnterpriseArchitectTypes() {
        assertEquals("StateNode", XmiStyles.eaType(NodeKind.FINAL));
        assertEquals("101", XmiStyles.eaSubtype(NodeKind.FINAL));
        assertEquals("Synchronization", XmiStyles.eaType(NodeKind.JOIN));
        assertEquals("0", XmiStyles.eaSubtype(NodeKind.ACTION));
        assertEquals("uml:ForkNode", XmiStyles.umlType(NodeKind.FORK));
    }

    @Test
    void shouldDrawDecisionsAsDiamonds() {
        String style = XmiStyles.styleFor(new DecisionNode("d", "Ok?", null), classifier);

        assertTrue(style.startsWith("BorderColor=-1;"));
        assertTrue(style.contains("Shape=Diamond;"));
    }
}

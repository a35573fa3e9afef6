package work.lcod.cond.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.cond.support.CondTestSupport.SERVICE_TYPE;
import static work.lcod.cond.support.CondTestSupport.USER_NAME;
import static work.lcod.cond.support.CondTestSupport.attr;
import static work.lcod.cond.support.CondTestSupport.string;
import static work.lcod.cond.support.CondTestSupport.uint32;

import org.junit.jupiter.api.Test;
import work.lcod.cond.api.ResultCode;
import work.lcod.cond.request.ListKind;
import work.lcod.cond.value.DataType;
import work.lcod.cond.value.Operator;

class ConditionsTest {
    @Test
    void chainLinksEntriesInOrder() {
        var first = Conditions.alwaysTrue();
        var marker = Conditions.and();
        var last = Conditions.alwaysFalse();

        var head = Conditions.chain(first, marker, last);

        assertSame(first, head);
        assertSame(marker, first.next());
        assertSame(last, marker.next());
        assertNull(last.next());
    }

    @Test
    void rejectsMisplacedMarkers() {
        assertThrows(IllegalArgumentException.class, () -> Conditions.chain(Conditions.and(), Conditions.alwaysTrue()));
        assertThrows(IllegalArgumentException.class, () -> Conditions.chain(Conditions.alwaysTrue(), Conditions.or()));
        assertThrows(IllegalArgumentException.class,
            () -> Conditions.chain(Conditions.alwaysTrue(), Conditions.and(), Conditions.or(), Conditions.alwaysFalse()));
        assertThrows(IllegalArgumentException.class, () -> Conditions.chain());
    }

    @Test
    void nodesCannotBeLinkedTwice() {
        var shared = Conditions.alwaysTrue();
        Conditions.all(shared, Conditions.alwaysFalse());

        assertThrows(IllegalArgumentException.class, () -> Conditions.any(shared, Conditions.alwaysFalse()));
        assertThrows(IllegalArgumentException.class, () -> Conditions.not(shared));
    }

    @Test
    void markersCannotBeNegated() {
        assertThrows(IllegalArgumentException.class, () -> Conditions.not(Conditions.and()));
    }

    @Test
    void groupAdoptsAnExistingChain() {
        var head = Conditions.any(Conditions.alwaysFalse(), Conditions.alwaysTrue());

        var group = Conditions.group(head);

        assertEquals(NodeKind.CHILD, group.kind());
        assertSame(head, group.child());
        for (var node = head; node != null; node = node.next()) {
            assertSame(group, node.parent());
        }
    }

    @Test
    void pairCompareNeedsAnAttribute() {
        assertThrows(IllegalArgumentException.class, () -> Conditions.pairCompare(string("a"), Operator.EQ, string("b")));
    }

    @Test
    void sizeCountsNestedNodesButNotMarkers() {
        var root = Conditions.all(
            Conditions.alwaysTrue(),
            Conditions.group(Conditions.any(Conditions.alwaysFalse(), Conditions.rcode(ResultCode.OK))));

        assertEquals(4, Conditions.size(root));
    }

    @Test
    void printsChainsOnOneLine() {
        var root = Conditions.all(
            Conditions.map(attr(USER_NAME), Operator.EQ, string("bob")),
            Conditions.not(Conditions.group(Conditions.any(
                Conditions.map(Template.attribute(ListKind.REPLY, SERVICE_TYPE, Template.NUM_LAST), Operator.NE, uint32(2)),
                Conditions.not(Conditions.rcode(ResultCode.OK))))));

        assertEquals("&User-Name == \"bob\" && !(&reply.Service-Type[n] != 2 || !ok)", ConditionPrinter.print(root));
        assertEquals("&User-Name == \"bob\"", ConditionPrinter.printNode(root));
    }

    @Test
    void printsCastsAndExpansions() {
        var map = Conditions.map(Template.xlat("%{User-Name}").withCast(DataType.UINT32), Operator.GE, Template.exec("/bin/id"));

        assertEquals("<uint32>\"%{User-Name}\" >= `/bin/id`", map.toString());
    }

    @Test
    void dumpsEveryField() {
        var root = Conditions.all(
            Conditions.map(attr(USER_NAME), Operator.EQ, string("bob")),
            Conditions.rcode(ResultCode.NOOP));

        var lines = ConditionDebug.dump(root);

        assertEquals("cond map", lines.get(0));
        assertEquals("\tnegate : false", lines.get(1));
        assertEquals("\tfixup  : none", lines.get(2));
        assertEquals("lhs (", lines.get(3));
        assertEquals("\ttmpl   : &User-Name", lines.get(4));
        assertEquals("\ttype   : attr", lines.get(5));
        assertTrue(lines.contains("\top     : =="));
        assertTrue(lines.contains("\tvalue  : string:bob"));
        assertTrue(lines.contains("cond &&"));
        assertEquals("\trcode  : noop", lines.get(lines.size() - 1));
    }
}

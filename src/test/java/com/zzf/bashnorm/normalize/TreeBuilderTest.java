package com.zzf.bashnorm.normalize;

import com.zzf.bashnorm.tree.ArgumentType;
import com.zzf.bashnorm.tree.BinaryLogicOpNode;
import com.zzf.bashnorm.tree.FlagNode;
import com.zzf.bashnorm.tree.HeadCommandNode;
import com.zzf.bashnorm.tree.NodeKind;
import com.zzf.bashnorm.tree.RootNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TreeBuilderTest {

    @Test
    public void shouldTrackParentsAndSiblings() {
        TreeBuilder builder = new TreeBuilder();
        int find = builder.attach(TreeBuilder.ROOT, NodeKind.HEAD_COMMAND, "find");
        int name = builder.attach(find, NodeKind.FLAG, "-name");
        int or = builder.attach(find, NodeKind.BINARY_LOGIC_OP, "-o");
        int type = builder.attach(find, NodeKind.FLAG, "-type");

        assertEquals(find, builder.parentOf(or));
        assertEquals(name, builder.leftSiblingOf(or));
        assertEquals(type, builder.rightSiblingOf(or));
        assertEquals(TreeBuilder.NONE, builder.leftSiblingOf(name));
        assertEquals(TreeBuilder.NONE, builder.rightSiblingOf(type));
        assertEquals(type, builder.lastChildOf(find));
        assertEquals(TreeBuilder.NONE, builder.lastChildOf(type));
    }

    @Test
    public void shouldReparentIntoOperatorSlotsInOrder() {
        TreeBuilder builder = new TreeBuilder();
        int find = builder.attach(TreeBuilder.ROOT, NodeKind.HEAD_COMMAND, "find");
        int name = builder.attach(find, NodeKind.FLAG, "-name");
        builder.attach(name, NodeKind.ARGUMENT, "a", ArgumentType.PATTERN);
        int or = builder.attach(find, NodeKind.BINARY_LOGIC_OP, "-o");
        int type = builder.attach(find, NodeKind.FLAG, "-type");

        builder.reparent(name, or);
        builder.reparent(type, or);

        assertEquals(1, builder.childCount(find));
        RootNode root = builder.build();
        HeadCommandNode head = (HeadCommandNode) root.children().get(0);
        BinaryLogicOpNode operator = (BinaryLogicOpNode) head.children().get(0);
        assertEquals("-name", ((FlagNode) operator.left()).name());
        assertEquals("-type", ((FlagNode) operator.right()).name());
    }

    @Test
    public void shouldRejectIllegalChildKinds() {
        TreeBuilder builder = new TreeBuilder();
        int pipeline = builder.attach(TreeBuilder.ROOT, NodeKind.PIPELINE, "");
        int ls = builder.attach(TreeBuilder.ROOT, NodeKind.HEAD_COMMAND, "ls");
        int argument = builder.attach(ls, NodeKind.ARGUMENT, "x");

        StructuralException underPipeline = assertThrows(StructuralException.class,
                () -> builder.attach(pipeline, NodeKind.ARGUMENT, "x"));
        assertEquals(StructuralException.Reason.ILLEGAL_CHILD, underPipeline.getReason());

        StructuralException underArgument = assertThrows(StructuralException.class,
                () -> builder.attach(argument, NodeKind.FLAG, "-l"));
        assertEquals(StructuralException.Reason.ILLEGAL_CHILD, underArgument.getReason());
    }

    @Test
    public void shouldRejectChildrenBeyondFixedArity() {
        TreeBuilder builder = new TreeBuilder();
        int substitution = builder.attach(TreeBuilder.ROOT, NodeKind.COMMAND_SUBSTITUTION, "");
        builder.attach(substitution, NodeKind.HEAD_COMMAND, "ls");

        StructuralException e = assertThrows(StructuralException.class,
                () -> builder.attach(substitution, NodeKind.HEAD_COMMAND, "wc"));
        assertEquals(StructuralException.Reason.ARITY_VIOLATION, e.getReason());
    }

    @Test
    public void shouldRefuseToFreezeIncompleteOperators() {
        TreeBuilder builder = new TreeBuilder();
        int find = builder.attach(TreeBuilder.ROOT, NodeKind.HEAD_COMMAND, "find");
        builder.attach(find, NodeKind.UNARY_LOGIC_OP, "-not");

        StructuralException e = assertThrows(StructuralException.class, builder::build);
        assertEquals(StructuralException.Reason.MISSING_OPERAND, e.getReason());
    }

    @Test
    public void shouldRefuseToFreezeEmptySubstitution() {
        TreeBuilder builder = new TreeBuilder();
        builder.attach(TreeBuilder.ROOT, NodeKind.COMMAND_SUBSTITUTION, "");

        StructuralException e = assertThrows(StructuralException.class, builder::build);
        assertEquals(StructuralException.Reason.ARITY_VIOLATION, e.getReason());
    }
}

package com.zzf.bashnorm.normalize;

import com.zzf.bashnorm.tree.ArgumentNode;
import com.zzf.bashnorm.tree.ArgumentType;
import com.zzf.bashnorm.tree.BinaryLogicOpNode;
import com.zzf.bashnorm.tree.CommandSubstitutionNode;
import com.zzf.bashnorm.tree.FlagNode;
import com.zzf.bashnorm.tree.HeadCommandNode;
import com.zzf.bashnorm.tree.NodeKind;
import com.zzf.bashnorm.tree.NormalizedNode;
import com.zzf.bashnorm.tree.PipelineNode;
import com.zzf.bashnorm.tree.ProcessSubstitutionNode;
import com.zzf.bashnorm.tree.RootNode;
import com.zzf.bashnorm.tree.UnaryLogicOpNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable arena the normalizer grows while scanning a raw tree. Nodes are addressed by index and
 * hold the index of their parent, so siblings are answered from the parent's child list instead of
 * per-node links. {@link #build()} freezes the arena into immutable {@link NormalizedNode} records.
 */
final class TreeBuilder {
    static final int ROOT = 0;
    static final int NONE = -1;

    private final List<Slot> slots = new ArrayList<>();

    TreeBuilder() {
        slots.add(new Slot(NodeKind.ROOT, "root", null, NONE));
    }

    int attach(int parent, NodeKind kind, String value) {
        return attach(parent, kind, value, null);
    }

    int attach(int parent, NodeKind kind, String value, ArgumentType type) {
        if (kind == NodeKind.ROOT) {
            throw new StructuralException(StructuralException.Reason.ILLEGAL_CHILD, "root cannot be nested");
        }
        Slot target = slot(parent);
        checkAdmissible(target, kind, value);
        int index = slots.size();
        slots.add(new Slot(kind, value == null ? "" : value, type, parent));
        target.children.add(index);
        return index;
    }

    /**
     * Moves {@code child} from its current parent to the end of {@code newParent}'s children.
     */
    void reparent(int child, int newParent) {
        Slot moved = slot(child);
        Slot target = slot(newParent);
        if (child == ROOT || child == newParent) {
            throw new StructuralException(StructuralException.Reason.ILLEGAL_CHILD,
                    "cannot move " + describe(moved) + " under " + describe(target));
        }
        checkAdmissible(target, moved.kind, moved.value);
        slot(moved.parent).children.remove(Integer.valueOf(child));
        moved.parent = newParent;
        target.children.add(child);
    }

    NodeKind kindOf(int index) {
        return slot(index).kind;
    }

    String valueOf(int index) {
        return slot(index).value;
    }

    int parentOf(int index) {
        return slot(index).parent;
    }

    int childCount(int index) {
        return slot(index).children.size();
    }

    int lastChildOf(int index) {
        List<Integer> children = slot(index).children;
        return children.isEmpty() ? NONE : children.get(children.size() - 1);
    }

    int leftSiblingOf(int index) {
        return siblingOf(index, -1);
    }

    int rightSiblingOf(int index) {
        return siblingOf(index, 1);
    }

    RootNode build() {
        List<NormalizedNode> children = new ArrayList<>();
        for (int child : slot(ROOT).children) {
            children.add(freeze(child));
        }
        return new RootNode(children);
    }

    private NormalizedNode freeze(int index) {
        Slot slot = slot(index);
        if (slot.kind.isFixedArity() && slot.children.size() != slot.kind.arity()) {
            StructuralException.Reason reason = slot.kind == NodeKind.UNARY_LOGIC_OP || slot.kind == NodeKind.BINARY_LOGIC_OP
                    ? StructuralException.Reason.MISSING_OPERAND
                    : StructuralException.Reason.ARITY_VIOLATION;
            throw new StructuralException(reason, describe(slot) + " needs exactly " + slot.kind.arity()
                    + " children but has " + slot.children.size());
        }
        List<NormalizedNode> children = new ArrayList<>();
        for (int child : slot.children) {
            children.add(freeze(child));
        }
        return switch (slot.kind) {
            case PIPELINE -> new PipelineNode(asStages(children));
            case HEAD_COMMAND -> new HeadCommandNode(slot.value, children);
            case FLAG -> new FlagNode(slot.value, children);
            case ARGUMENT -> new ArgumentNode(slot.value, slot.type);
            case UNARY_LOGIC_OP -> new UnaryLogicOpNode(slot.value, children.get(0));
            case BINARY_LOGIC_OP -> new BinaryLogicOpNode(slot.value, children.get(0), children.get(1));
            case COMMAND_SUBSTITUTION -> new CommandSubstitutionNode(children.get(0));
            case PROCESS_SUBSTITUTION -> new ProcessSubstitutionNode(slot.value, children.get(0));
            case ROOT -> throw new StructuralException(StructuralException.Reason.ILLEGAL_CHILD, "nested root");
        };
    }

    private static List<HeadCommandNode> asStages(List<NormalizedNode> children) {
        List<HeadCommandNode> stages = new ArrayList<>();
        for (NormalizedNode child : children) {
            stages.add((HeadCommandNode) child);
        }
        return stages;
    }

    private void checkAdmissible(Slot parent, NodeKind kind, String value) {
        if (!parent.kind.accepts(kind)) {
            throw new StructuralException(StructuralException.Reason.ILLEGAL_CHILD,
                    kind.tag() + " '" + value + "' cannot be a child of " + describe(parent));
        }
        if (parent.kind.isFixedArity() && parent.children.size() >= parent.kind.arity()) {
            throw new StructuralException(StructuralException.Reason.ARITY_VIOLATION,
                    describe(parent) + " already holds " + parent.kind.arity() + " children");
        }
    }

    private int siblingOf(int index, int offset) {
        Slot node = slot(index);
        if (node.parent == NONE) {
            return NONE;
        }
        List<Integer> siblings = slot(node.parent).children;
        int position = siblings.indexOf(index) + offset;
        return position >= 0 && position < siblings.size() ? siblings.get(position) : NONE;
    }

    private Slot slot(int index) {
        if (index < 0 || index >= slots.size()) {
            throw new IllegalArgumentException("no node at index " + index);
        }
        return slots.get(index);
    }

    private static String describe(Slot slot) {
        return slot.value.isEmpty() ? slot.kind.tag() : slot.kind.tag() + " '" + slot.value + "'";
    }

    private static final class Slot {
        private final NodeKind kind;
        private final String value;
        private final ArgumentType type;
        private final List<Integer> children = new ArrayList<>();
        private int parent;

        Slot(NodeKind kind, String value, ArgumentType type, int parent) {
            this.kind = kind;
            this.value = value;
            this.type = type;
            this.parent = parent;
        }
    }
}

package org.ltlspec.tree;

import org.ltlspec.exceptions.MalformedTreeException;
import org.ltlspec.expressions.Node;
import org.ltlspec.expressions.Operator;
import org.ltlspec.expressions.Terminal;
import org.ltlspec.expressions.terminals.Var;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * AST 的图表示，作为语法改写的脚手架。
 * <p>
 * 每个 AST 节点对应一个顶点，顶点以稳定的整数句柄标识，存放在一个数组 (arena) 中。
 * 每个顶点记录其标签 (终结符或运算符)、按位置排列的子顶点句柄以及父顶点句柄；
 * 子顶点在列表中的下标就是边的 position 属性，用于恢复运算数顺序。
 * <p>
 * 不变量：恰有一个根；除根以外的顶点恰有一条入边；
 * 顶点的出度等于其运算符的元数 (终结符为 0)。
 * <p>
 * 改写在原地进行，不能在多个线程中同时改写同一棵树；需要并发改写时先 {@link #copy()}。
 */
public final class Tree {

    private static final Logger logger = LoggerFactory.getLogger(Tree.class);

    private static final int NO_PARENT = -1;

    /** 顶点句柄 -> 顶点；被删除的顶点位置为 null，句柄不会复用。 */
    private final List<Vertex> arena;
    private int root;
    private int size;

    private static final class Vertex {
        private Node label;
        private final List<Integer> children;
        private int parent;

        private Vertex(Node label, int parent) {
            this.label = label;
            this.children = new ArrayList<>();
            this.parent = parent;
        }

        private Vertex(Vertex other) {
            this.label = other.label;
            this.children = new ArrayList<>(other.children);
            this.parent = other.parent;
        }
    }

    private Tree() {
        this.arena = new ArrayList<>();
        this.root = NO_PARENT;
        this.size = 0;
    }

    // --- 与递归 AST 之间的转换 ---

    /**
     * 从递归 AST 构建树。
     * 终结符作为孤立顶点插入 (处理只有一个节点的公式)；
     * 运算符对每个运算数插入一条带位置的边，然后递归处理该运算数。
     * @param root 递归 AST 的根。
     * @return 新的 Tree。
     * @throws MalformedTreeException 如果某个节点既不是终结符也不是运算符。
     */
    public static Tree fromRecursiveAst(Node root) {
        Objects.requireNonNull(root, "Tree.fromRecursiveAst: root 不能为 null");
        Tree tree = new Tree();
        tree.root = tree.insert(root, NO_PARENT);
        logger.debug("从递归 AST 构建了含 {} 个顶点的树: {}", tree.size, root);
        return tree;
    }

    private int insert(Node node, int parent) {
        int handle = newVertex(node, parent);
        if (node instanceof Terminal) {
            return handle;
        }
        if (node instanceof Operator) {
            Operator operator = (Operator) node;
            for (Node operand : operator.getOperands()) {
                int child = insert(operand, handle);
                arena.get(handle).children.add(child);
            }
            return handle;
        }
        logger.error("未知的 AST 节点类型: {} ({})", node, node.getClass().getName());
        throw new MalformedTreeException("未知的 AST 节点类型: " + node.getClass().getName());
    }

    private int newVertex(Node label, int parent) {
        arena.add(new Vertex(label, parent));
        size++;
        return arena.size() - 1;
    }

    /**
     * @return 以根为起点的递归 AST。
     */
    public Node toRecursiveAst() {
        return toRecursiveAst(root);
    }

    /**
     * 从指定顶点开始重建递归 AST。
     * 没有出边的顶点原样返回 (必须是终结符)；
     * 否则浅拷贝该顶点，按边的位置依次转换子顶点并作为新的运算数序列。
     * @param from 起始顶点。
     * @return 递归 AST。
     * @throws MalformedTreeException 如果顶点的出度与其标签不一致。
     */
    public Node toRecursiveAst(int from) {
        Vertex vertex = vertex(from);
        if (vertex.children.isEmpty()) {
            if (!(vertex.label instanceof Terminal)) {
                throw new MalformedTreeException("没有出边的顶点 " + from + " 不是终结符: " + vertex.label);
            }
            return vertex.label;
        }
        if (!(vertex.label instanceof Operator)) {
            throw new MalformedTreeException("有出边的顶点 " + from + " 不是运算符: " + vertex.label);
        }
        List<Node> operands = new ArrayList<>(vertex.children.size());
        for (int child : vertex.children) {
            operands.add(toRecursiveAst(child));
        }
        Operator operator = (Operator) vertex.label;
        if (operands.size() != operator.getArity()) {
            throw new MalformedTreeException("顶点 " + from + " 的出度 " + operands.size()
                    + " 与运算符 " + operator.getType().getSymbol() + " 的元数不符");
        }
        return operator.withOperands(operands);
    }

    // --- 查询 ---

    public int getRoot() {
        return root;
    }

    public int size() {
        return size;
    }

    public boolean contains(int handle) {
        return handle >= 0 && handle < arena.size() && arena.get(handle) != null;
    }

    /**
     * @return 所有存活顶点的句柄，按创建顺序。
     */
    public List<Integer> vertices() {
        List<Integer> handles = new ArrayList<>(size);
        for (int i = 0; i < arena.size(); i++) {
            if (arena.get(i) != null) {
                handles.add(i);
            }
        }
        return handles;
    }

    public Node getLabel(int handle) {
        return vertex(handle).label;
    }

    /**
     * @return 按位置排列的子顶点句柄。
     */
    public List<Integer> getChildren(int handle) {
        return Collections.unmodifiableList(vertex(handle).children);
    }

    public boolean isLeaf(int handle) {
        return vertex(handle).children.isEmpty();
    }

    /**
     * @return 父顶点句柄；根没有父顶点。
     */
    public OptionalInt getParent(int handle) {
        int parent = vertex(handle).parent;
        return parent == NO_PARENT ? OptionalInt.empty() : OptionalInt.of(parent);
    }

    /**
     * @return 顶点在其父顶点运算数中的位置；根返回 -1。
     */
    public int positionOf(int handle) {
        int parent = vertex(handle).parent;
        if (parent == NO_PARENT) {
            return -1;
        }
        return arena.get(parent).children.indexOf(handle);
    }

    /**
     * @return 标签为变量的顶点句柄。
     */
    public List<Integer> variables() {
        List<Integer> handles = new ArrayList<>();
        for (int handle : vertices()) {
            if (arena.get(handle).label instanceof Var) {
                handles.add(handle);
            }
        }
        return handles;
    }

    /**
     * @return 树中出现的变量名。
     */
    public Set<String> variableNames() {
        Set<String> names = new LinkedHashSet<>();
        for (int handle : variables()) {
            names.add(((Var) arena.get(handle).label).getName());
        }
        return names;
    }

    // --- 原地改写 ---

    /**
     * 原地替换顶点的标签，边保持不变。
     * @param handle 顶点。
     * @param label 新标签；运算符标签的元数必须等于顶点的出度，终结符只能放在叶子上。
     * @throws MalformedTreeException 如果新标签与顶点的出度不一致。
     */
    public void relabel(int handle, Node label) {
        Objects.requireNonNull(label, "Tree.relabel: label 不能为 null");
        Vertex vertex = vertex(handle);
        int degree = vertex.children.size();
        int arity = label instanceof Operator ? ((Operator) label).getArity() : 0;
        if (arity != degree) {
            throw new MalformedTreeException("不能将出度为 " + degree + " 的顶点 " + handle + " 重新标记为 " + label);
        }
        logger.debug("顶点 {} 重新标记: {} -> {}", handle, vertex.label, label);
        vertex.label = label;
    }

    /**
     * 将 subtree 嫁接到叶子 leaf 的位置。
     * subtree 的所有边被并入本树；若 leaf 有入边 (parent, leaf, position)，
     * 将其改为 (parent, subtree 的根, position)，否则 subtree 的根成为新的根；
     * 最后删除 leaf。subtree 本身不被修改。
     * @param leaf 本树中没有子顶点的顶点。
     * @param subtree 要嫁接的树。
     * @return 嫁接后 subtree 的根在本树中的句柄。
     * @throws MalformedTreeException 如果 leaf 有子顶点。
     */
    public int addSubtree(int leaf, Tree subtree) {
        Objects.requireNonNull(subtree, "Tree.addSubtree: subtree 不能为 null");
        Vertex leafVertex = vertex(leaf);
        if (!leafVertex.children.isEmpty()) {
            throw new MalformedTreeException("嫁接位置 " + leaf + " 不是叶子: " + leafVertex.label);
        }
        Tree source = subtree == this ? subtree.copy() : subtree;

        Map<Integer, Integer> oldToNew = new HashMap<>();
        for (int handle : source.vertices()) {
            oldToNew.put(handle, newVertex(source.arena.get(handle).label, NO_PARENT));
        }
        for (Map.Entry<Integer, Integer> entry : oldToNew.entrySet()) {
            Vertex copied = arena.get(entry.getValue());
            Vertex original = source.arena.get(entry.getKey());
            for (int child : original.children) {
                copied.children.add(oldToNew.get(child));
            }
            if (original.parent != NO_PARENT) {
                copied.parent = oldToNew.get(original.parent);
            }
        }
        int graftedRoot = oldToNew.get(source.root);

        int parent = leafVertex.parent;
        if (parent == NO_PARENT) {
            root = graftedRoot;
        } else {
            List<Integer> siblings = arena.get(parent).children;
            siblings.set(siblings.indexOf(leaf), graftedRoot);
            arena.get(graftedRoot).parent = parent;
        }
        arena.set(leaf, null);
        size--;
        logger.debug("在顶点 {} 处嫁接了含 {} 个顶点的子树 {}", leaf, source.size, source);
        return graftedRoot;
    }

    /**
     * @return 深拷贝；句柄保持不变，标签 (不可变节点) 共享。
     */
    public Tree copy() {
        Tree clone = new Tree();
        for (Vertex vertex : arena) {
            clone.arena.add(vertex == null ? null : new Vertex(vertex));
        }
        clone.root = root;
        clone.size = size;
        return clone;
    }

    private Vertex vertex(int handle) {
        if (!contains(handle)) {
            throw new IllegalArgumentException("树中不存在顶点 " + handle);
        }
        return arena.get(handle);
    }

    @Override
    public String toString() {
        return toRecursiveAst().toString();
    }
}

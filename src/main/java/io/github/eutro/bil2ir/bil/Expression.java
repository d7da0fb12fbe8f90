package io.github.eutro.bil2ir.bil;

import io.github.eutro.bil2ir.bits.Bitvector;
import io.github.eutro.bil2ir.util.TreeNode;
import io.github.eutro.bil2ir.util.Trees;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An expression of the lifted (BIL) language.
 * <p>
 * Each node owns its children exclusively; no subtree is shared between two parents.
 * Use {@link #copy()} to place an expression in more than one position.
 * <p>
 * {@link #equals(Object)}, {@link #hashCode()}, {@link #toString()} and {@link #copy()}
 * are structural and iterative, so they work on arbitrarily deep trees.
 */
public abstract class Expression implements TreeNode<Expression> {
    Expression() {
    }

    /**
     * Create a node of the same variant, with the same attributes, but the given children.
     *
     * @param children The children, as many as {@link #children()} returns, in the same order.
     * @return The new node.
     */
    public abstract Expression rebuild(List<Expression> children);

    /**
     * Deep copy this expression.
     *
     * @return An equal expression sharing no nodes with this one.
     */
    public Expression copy() {
        return Trees.fold(this, Expression::rebuild);
    }

    /**
     * Compute the width of the value this expression evaluates to.
     *
     * @return The width, in bits.
     * @throws IllegalStateException If the expression contains a {@link Let} where its width
     *                               is needed, or a variable of a non-register type.
     * @see BitSizes
     */
    public int bitSize() {
        return BitSizes.bitSize(this);
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) return true;
        return obj instanceof Expression && Trees.equal(this, (Expression) obj);
    }

    @Override
    public final int hashCode() {
        return Trees.hash(this);
    }

    @NotNull
    @Override
    public final String toString() {
        return Trees.print(this);
    }

    private static List<Expression> leaf() {
        return Collections.emptyList();
    }

    public static class Var extends Expression {
        public Variable variable;

        public Var(Variable variable) {
            this.variable = variable;
        }

        @Override
        public List<Expression> children() {
            return leaf();
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new Var(variable);
        }

        @Override
        public boolean shallowEquals(Expression other) {
            return other instanceof Var && variable.equals(((Var) other).variable);
        }

        @Override
        public int shallowHashCode() {
            return variable.hashCode();
        }

        @Override
        public void appendParts(List<Object> parts) {
            parts.add(variable.toString());
        }
    }

    public static class Const extends Expression {
        public Bitvector value;

        public Const(Bitvector value) {
            this.value = value;
        }

        @Override
        public List<Expression> children() {
            return leaf();
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new Const(value);
        }

        @Override
        public boolean shallowEquals(Expression other) {
            return other instanceof Const && value.equals(((Const) other).value);
        }

        @Override
        public int shallowHashCode() {
            return value.hashCode();
        }

        @Override
        public void appendParts(List<Object> parts) {
            parts.add(value.toString());
        }
    }

    /**
     * Reads {@code size} bits from {@code memory} at {@code address}.
     */
    public static class Load extends Expression {
        public Expression memory;
        public Expression address;
        public Endianness endian;
        public int size;

        public Load(Expression memory, Expression address, Endianness endian, int size) {
            this.memory = memory;
            this.address = address;
            this.endian = endian;
            this.size = size;
        }

        @Override
        public List<Expression> children() {
            return Arrays.asList(memory, address);
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new Load(children.get(0), children.get(1), endian, size);
        }

        @Override
        public boolean shallowEquals(Expression other) {
            if (!(other instanceof Load)) return false;
            Load that = (Load) other;
            return endian == that.endian && size == that.size;
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(Load.class, endian, size);
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, memory, "[", address, ", ", endian.toString(), "]:u", Integer.toString(size));
        }
    }

    /**
     * Writes {@code value} into {@code memory} at {@code address}, evaluating to the new memory.
     */
    public static class Store extends Expression {
        public Expression memory;
        public Expression address;
        public Expression value;
        public Endianness endian;
        public int size;

        public Store(Expression memory, Expression address, Expression value, Endianness endian, int size) {
            this.memory = memory;
            this.address = address;
            this.value = value;
            this.endian = endian;
            this.size = size;
        }

        @Override
        public List<Expression> children() {
            return Arrays.asList(memory, address, value);
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new Store(children.get(0), children.get(1), children.get(2), endian, size);
        }

        @Override
        public boolean shallowEquals(Expression other) {
            if (!(other instanceof Store)) return false;
            Store that = (Store) other;
            return endian == that.endian && size == that.size;
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(Store.class, endian, size);
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, memory, " with [", address, ", ", endian.toString(), "]:u",
                    Integer.toString(size), " <- ", value);
        }
    }

    public static class BinOp extends Expression {
        public BinOpType op;
        public Expression lhs;
        public Expression rhs;

        public BinOp(BinOpType op, Expression lhs, Expression rhs) {
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public List<Expression> children() {
            return Arrays.asList(lhs, rhs);
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new BinOp(op, children.get(0), children.get(1));
        }

        @Override
        public boolean shallowEquals(Expression other) {
            return other instanceof BinOp && op == ((BinOp) other).op;
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(BinOp.class, op);
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, "(", lhs, " " + op + " ", rhs, ")");
        }
    }

    public static class UnOp extends Expression {
        public UnOpType op;
        public Expression arg;

        public UnOp(UnOpType op, Expression arg) {
            this.op = op;
            this.arg = arg;
        }

        @Override
        public List<Expression> children() {
            return Collections.singletonList(arg);
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new UnOp(op, children.get(0));
        }

        @Override
        public boolean shallowEquals(Expression other) {
            return other instanceof UnOp && op == ((UnOp) other).op;
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(UnOp.class, op);
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, op + "(", arg, ")");
        }
    }

    public static class Cast extends Expression {
        public CastType kind;
        public int width;
        public Expression arg;

        public Cast(CastType kind, int width, Expression arg) {
            this.kind = kind;
            this.width = width;
            this.arg = arg;
        }

        @Override
        public List<Expression> children() {
            return Collections.singletonList(arg);
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new Cast(kind, width, children.get(0));
        }

        @Override
        public boolean shallowEquals(Expression other) {
            if (!(other instanceof Cast)) return false;
            Cast that = (Cast) other;
            return kind == that.kind && width == that.width;
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(Cast.class, kind, width);
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, kind + ":" + width + "[", arg, "]");
        }
    }

    /**
     * Binds {@code var} to {@code boundExp} within {@code bodyExp}.
     * <p>
     * Only produced by the lifter; removed by
     * {@link io.github.eutro.bil2ir.passes.form.ReplaceLetBindings} before anything else
     * looks at the tree.
     */
    public static class Let extends Expression {
        public Variable var;
        public Expression boundExp;
        public Expression bodyExp;

        public Let(Variable var, Expression boundExp, Expression bodyExp) {
            this.var = var;
            this.boundExp = boundExp;
            this.bodyExp = bodyExp;
        }

        @Override
        public List<Expression> children() {
            return Arrays.asList(boundExp, bodyExp);
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new Let(var, children.get(0), children.get(1));
        }

        @Override
        public boolean shallowEquals(Expression other) {
            return other instanceof Let && var.equals(((Let) other).var);
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(Let.class, var);
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, "(let ", var.toString(), " = ", boundExp, " in ", bodyExp, ")");
        }
    }

    public static class Unknown extends Expression {
        public String description;
        public Type type;

        public Unknown(String description, Type type) {
            this.description = description;
            this.type = type;
        }

        @Override
        public List<Expression> children() {
            return leaf();
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new Unknown(description, type);
        }

        @Override
        public boolean shallowEquals(Expression other) {
            if (!(other instanceof Unknown)) return false;
            Unknown that = (Unknown) other;
            return description.equals(that.description) && type.equals(that.type);
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(Unknown.class, description, type);
        }

        @Override
        public void appendParts(List<Object> parts) {
            parts.add("unknown[" + description + "]:" + type);
        }
    }

    public static class IfThenElse extends Expression {
        public Expression condition;
        public Expression trueExp;
        public Expression falseExp;

        public IfThenElse(Expression condition, Expression trueExp, Expression falseExp) {
            this.condition = condition;
            this.trueExp = trueExp;
            this.falseExp = falseExp;
        }

        @Override
        public List<Expression> children() {
            return Arrays.asList(condition, trueExp, falseExp);
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new IfThenElse(children.get(0), children.get(1), children.get(2));
        }

        @Override
        public boolean shallowEquals(Expression other) {
            return other instanceof IfThenElse;
        }

        @Override
        public int shallowHashCode() {
            return IfThenElse.class.hashCode();
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, "(if ", condition, " then ", trueExp, " else ", falseExp, ")");
        }
    }

    /**
     * Selects the bits {@code lowBit} through {@code highBit} of {@code arg}.
     */
    public static class Extract extends Expression {
        public int lowBit;
        public int highBit;
        public Expression arg;

        public Extract(int lowBit, int highBit, Expression arg) {
            this.lowBit = lowBit;
            this.highBit = highBit;
            this.arg = arg;
        }

        @Override
        public List<Expression> children() {
            return Collections.singletonList(arg);
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new Extract(lowBit, highBit, children.get(0));
        }

        @Override
        public boolean shallowEquals(Expression other) {
            if (!(other instanceof Extract)) return false;
            Extract that = (Extract) other;
            return lowBit == that.lowBit && highBit == that.highBit;
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(Extract.class, lowBit, highBit);
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, "extract:" + highBit + ":" + lowBit + "[", arg, "]");
        }
    }

    /**
     * Concatenates two bitvectors, {@code left} forming the most significant bits.
     */
    public static class Concat extends Expression {
        public Expression left;
        public Expression right;

        public Concat(Expression left, Expression right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public List<Expression> children() {
            return Arrays.asList(left, right);
        }

        @Override
        public Expression rebuild(List<Expression> children) {
            return new Concat(children.get(0), children.get(1));
        }

        @Override
        public boolean shallowEquals(Expression other) {
            return other instanceof Concat;
        }

        @Override
        public int shallowHashCode() {
            return Concat.class.hashCode();
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, "(", left, " @ ", right, ")");
        }
    }
}

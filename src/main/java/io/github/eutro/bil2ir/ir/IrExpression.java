package io.github.eutro.bil2ir.ir;

import io.github.eutro.bil2ir.bits.Bitvector;
import io.github.eutro.bil2ir.util.TreeNode;
import io.github.eutro.bil2ir.util.Trees;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A side-effect free expression of the analysis IR.
 * <p>
 * Unlike the lifted language, this has no memory accesses, bindings or conditionals;
 * width changes are expressed only through {@link Cast}s and {@link Subpiece}s, with
 * sizes in bytes.
 */
public abstract class IrExpression implements TreeNode<IrExpression> {
    IrExpression() {
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) return true;
        return obj instanceof IrExpression && Trees.equal(this, (IrExpression) obj);
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

    public static final class Var extends IrExpression {
        public final IrVariable variable;

        public Var(IrVariable variable) {
            this.variable = variable;
        }

        @Override
        public List<IrExpression> children() {
            return Collections.emptyList();
        }

        @Override
        public boolean shallowEquals(IrExpression other) {
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

    public static final class Const extends IrExpression {
        public final Bitvector value;

        public Const(Bitvector value) {
            this.value = value;
        }

        @Override
        public List<IrExpression> children() {
            return Collections.emptyList();
        }

        @Override
        public boolean shallowEquals(IrExpression other) {
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

    public static final class BinOp extends IrExpression {
        public final IrBinOpType op;
        public final IrExpression lhs;
        public final IrExpression rhs;

        public BinOp(IrBinOpType op, IrExpression lhs, IrExpression rhs) {
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public List<IrExpression> children() {
            return Arrays.asList(lhs, rhs);
        }

        @Override
        public boolean shallowEquals(IrExpression other) {
            return other instanceof BinOp && op == ((BinOp) other).op;
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(BinOp.class, op);
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, op + "(", lhs, ", ", rhs, ")");
        }
    }

    public static final class UnOp extends IrExpression {
        public final IrUnOpType op;
        public final IrExpression arg;

        public UnOp(IrUnOpType op, IrExpression arg) {
            this.op = op;
            this.arg = arg;
        }

        @Override
        public List<IrExpression> children() {
            return Collections.singletonList(arg);
        }

        @Override
        public boolean shallowEquals(IrExpression other) {
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

    public static final class Cast extends IrExpression {
        public final IrCastOpType op;
        public final ByteSize size;
        public final IrExpression arg;

        public Cast(IrCastOpType op, ByteSize size, IrExpression arg) {
            this.op = op;
            this.size = size;
            this.arg = arg;
        }

        @Override
        public List<IrExpression> children() {
            return Collections.singletonList(arg);
        }

        @Override
        public boolean shallowEquals(IrExpression other) {
            if (!(other instanceof Cast)) return false;
            Cast that = (Cast) other;
            return op == that.op && size.equals(that.size);
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(Cast.class, op, size);
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, op + ":" + size + "(", arg, ")");
        }
    }

    public static final class Unknown extends IrExpression {
        public final String description;
        public final ByteSize size;

        public Unknown(String description, ByteSize size) {
            this.description = description;
            this.size = size;
        }

        @Override
        public List<IrExpression> children() {
            return Collections.emptyList();
        }

        @Override
        public boolean shallowEquals(IrExpression other) {
            if (!(other instanceof Unknown)) return false;
            Unknown that = (Unknown) other;
            return description.equals(that.description) && size.equals(that.size);
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(Unknown.class, description, size);
        }

        @Override
        public void appendParts(List<Object> parts) {
            parts.add("unknown[" + description + "]:" + size);
        }
    }

    /**
     * Selects {@code size} bytes of {@code arg}, starting {@code lowByte} bytes
     * from the least significant end.
     */
    public static final class Subpiece extends IrExpression {
        public final ByteSize lowByte;
        public final ByteSize size;
        public final IrExpression arg;

        public Subpiece(ByteSize lowByte, ByteSize size, IrExpression arg) {
            this.lowByte = lowByte;
            this.size = size;
            this.arg = arg;
        }

        @Override
        public List<IrExpression> children() {
            return Collections.singletonList(arg);
        }

        @Override
        public boolean shallowEquals(IrExpression other) {
            if (!(other instanceof Subpiece)) return false;
            Subpiece that = (Subpiece) other;
            return lowByte.equals(that.lowByte) && size.equals(that.size);
        }

        @Override
        public int shallowHashCode() {
            return Objects.hash(Subpiece.class, lowByte, size);
        }

        @Override
        public void appendParts(List<Object> parts) {
            Collections.addAll(parts, "SUBPIECE[" + lowByte + ".." + size + "](", arg, ")");
        }
    }
}

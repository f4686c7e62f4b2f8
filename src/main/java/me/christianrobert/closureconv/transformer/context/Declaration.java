package me.christianrobert.closureconv.transformer.context;

/**
 * The emitted declaration of one binding.
 *
 * <p>Every version of a binding shares the same declaration until the name is shadowed, so a
 * later rebinding or in-place mutation can still turn an already written {@code const} into
 * {@code var}. The keyword is read when the output is rendered.</p>
 * <pre>
 * total = 0              # const total = 0;
 * total = Record(total)  # const total__1 = Record.init(total);   new binding, total stays const
 * count = 0              # var count = 0;
 * count = count + 1      # count = (count + 1);                  marks count's declaration
 * </pre>
 */
public class Declaration {

    private boolean mutable;

    public Declaration(boolean mutable) {
        this.mutable = mutable;
    }

    public boolean isMutable() {
        return mutable;
    }

    public void markMutable() {
        mutable = true;
    }

    public String keyword() {
        return mutable ? "var" : "const";
    }

    @Override
    public String toString() {
        return keyword();
    }
}

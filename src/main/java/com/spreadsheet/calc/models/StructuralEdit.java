package com.spreadsheet.calc.models;

/**
 * One structural change along a single axis (rows or columns):
 * inserting a blank line before {@code index}, deleting the line at {@code index},
 * or moving the line at {@code index} so that it ends up at {@code toIndex}.
 */
public final class StructuralEdit {

    public enum Kind {
        INSERT,
        DELETE,
        MOVE
    }

    /**
     * Marks a position that no longer exists after a delete.
     */
    public static final int REMOVED = -1;

    private final Kind kind;
    private final int index;
    private final int toIndex;

    private StructuralEdit(Kind kind, int index, int toIndex) {
        if (index < 0 || toIndex < 0) {
            throw new IllegalArgumentException("Negative index in " + kind + " edit: " + index + " -> " + toIndex);
        }
        this.kind = kind;
        this.index = index;
        this.toIndex = toIndex;
    }

    public static StructuralEdit insert(int index) {
        return new StructuralEdit(Kind.INSERT, index, index);
    }

    public static StructuralEdit delete(int index) {
        return new StructuralEdit(Kind.DELETE, index, index);
    }

    public static StructuralEdit move(int fromIndex, int toIndex) {
        return new StructuralEdit(Kind.MOVE, fromIndex, toIndex);
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    public int getToIndex() {
        return toIndex;
    }

    /**
     * Where a line that sat at {@code position} before the edit sits afterwards,
     * or {@link #REMOVED} if the edit deleted it.
     */
    public int remap(int position) {
        switch (kind) {
            case INSERT:
                return position >= index ? position + 1 : position;
            case DELETE:
                if (position == index) {
                    return REMOVED;
                }
                return position > index ? position - 1 : position;
            case MOVE:
                if (position == index) {
                    return toIndex;
                }
                if (index < toIndex && position > index && position <= toIndex) {
                    return position - 1;
                }
                if (index > toIndex && position >= toIndex && position < index) {
                    return position + 1;
                }
                return position;
            default:
                throw new IllegalStateException("Unknown edit kind: " + kind);
        }
    }

    @Override
    public String toString() {
        return kind == Kind.MOVE ? "MOVE " + index + " -> " + toIndex : kind + " " + index;
    }
}

package com.deskmate.models;

import java.util.Objects;

public class MotionReference {
    private final String group;
    private final int index;

    public MotionReference(String group, int index) {
        if (group == null) {
            throw new IllegalArgumentException("Motion group is required");
        }
        if (index < 0) {
            throw new IllegalArgumentException("Motion index must be >= 0: " + index);
        }
        this.group = group;
        this.index = index;
    }

    public String getGroup() {
        return group;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MotionReference)) return false;
        MotionReference that = (MotionReference) o;
        return index == that.index && group.equals(that.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(group, index);
    }

    @Override
    public String toString() {
        return group + "[" + index + "]";
    }
}

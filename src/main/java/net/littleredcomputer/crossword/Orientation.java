// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

public enum Orientation {
    ACROSS(0, 1),
    DOWN(1, 0);

    final int dRow;
    final int dColumn;

    Orientation(int dRow, int dColumn) {
        this.dRow = dRow;
        this.dColumn = dColumn;
    }
}

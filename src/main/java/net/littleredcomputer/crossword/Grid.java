// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The cell layout of a crossword, read from a structure description, and the text and
 * image renderings of a fill of it.
 */
public class Grid {
    static final char OPEN = '_';
    static final char BLOCKED = '█';
    static final int CELL_SIZE = 100;
    static final int CELL_BORDER = 2;
    private final int height;
    private final int width;
    private final boolean[][] open;
    private final ImmutableList<Slot> slots;

    private Grid(List<String> rows) {
        height = rows.size();
        width = rows.stream().mapToInt(String::length).max().orElse(0);
        if (height == 0 || width == 0) throw new IllegalArgumentException("empty structure");
        open = new boolean[height][width];
        for (int i = 0; i < height; ++i) {
            String row = rows.get(i);
            for (int j = 0; j < row.length(); ++j) open[i][j] = row.charAt(j) == OPEN;
        }
        slots = findSlots();
    }

    public static Grid parseFrom(String structure) {
        return parseFrom(new StringReader(structure));
    }

    /**
     * Parses a structure description: one line per row, where {@code _} marks a fillable
     * cell and any other character a blocked one. Short lines are padded with blocked cells.
     * @param structure textual description of the grid
     * @return the grid
     */
    public static Grid parseFrom(Reader structure) {
        return new Grid(new BufferedReader(structure).lines().collect(Collectors.toList()));
    }

    public int height() { return height; }
    public int width() { return width; }

    public boolean isOpen(int i, int j) {
        return open[i][j];
    }

    /** Maximal runs of two or more fillable cells, across and down. */
    public ImmutableList<Slot> slots() {
        return slots;
    }

    public Crossword crossword() {
        return Crossword.fromSlots(slots);
    }

    private ImmutableList<Slot> findSlots() {
        List<Slot> ss = new ArrayList<>();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (!open[i][j]) continue;
                if (j == 0 || !open[i][j-1]) {
                    int n = 1;
                    while (j + n < width && open[i][j+n]) ++n;
                    if (n > 1) ss.add(new Slot(i, j, Orientation.ACROSS, n));
                }
                if (i == 0 || !open[i-1][j]) {
                    int n = 1;
                    while (i + n < height && open[i+n][j]) ++n;
                    if (n > 1) ss.add(new Slot(i, j, Orientation.DOWN, n));
                }
            }
        }
        return ImmutableList.copyOf(ss);
    }

    /**
     * @return the grid with the assignment's letters filled in, one line per row
     */
    public String render(Assignment assignment) {
        char[][] board = new char[height][width];
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                board[i][j] = open[i][j] ? ' ' : BLOCKED;
            }
        }
        for (Map.Entry<Slot, String> e : assignment.asMap().entrySet()) {
            Slot s = e.getKey();
            String w = e.getValue();
            for (int k = 0; k < s.length() && k < w.length(); ++k) board[s.rowOf(k)][s.columnOf(k)] = w.charAt(k);
        }
        StringBuilder sb = new StringBuilder();
        for (char[] row : board) sb.append(row).append('\n');
        return sb.toString();
    }

    /**
     * Draws the fill as a PNG image: a black canvas with a white square for each open cell,
     * and each assigned letter centred in its square.
     * @param assignment the fill to draw
     * @param file where to write the image
     * @throws IOException if the image cannot be written
     */
    public void save(Assignment assignment, File file) throws IOException {
        char[][] letters = new char[height][width];
        for (Map.Entry<Slot, String> e : assignment.asMap().entrySet()) {
            Slot s = e.getKey();
            String w = e.getValue();
            for (int k = 0; k < s.length() && k < w.length(); ++k) letters[s.rowOf(k)][s.columnOf(k)] = w.charAt(k);
        }
        final int interior = CELL_SIZE - 2 * CELL_BORDER;
        BufferedImage image = new BufferedImage(width * CELL_SIZE, height * CELL_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            FontMetrics fm = null;
            for (int i = 0; i < height; ++i) {
                for (int j = 0; j < width; ++j) {
                    if (!open[i][j]) continue;
                    int left = j * CELL_SIZE + CELL_BORDER;
                    int top = i * CELL_SIZE + CELL_BORDER;
                    g.setColor(Color.WHITE);
                    g.fillRect(left, top, interior, interior);
                    if (letters[i][j] == 0) continue;
                    if (fm == null) {
                        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 80));
                        fm = g.getFontMetrics();
                    }
                    String letter = String.valueOf(letters[i][j]);
                    g.setColor(Color.BLACK);
                    g.drawString(letter,
                            left + (interior - fm.stringWidth(letter)) / 2,
                            top + (interior - fm.getHeight()) / 2 + fm.getAscent());
                }
            }
        } finally {
            g.dispose();
        }
        if (!ImageIO.write(image, "png", file)) throw new IOException("no PNG writer available for " + file);
    }
}

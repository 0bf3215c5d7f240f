package net.littleredcomputer.crossword;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Draws an assignment onto the crossword grid, as text or as an image.
 */
public class Renderer {
    static final char BLOCKED = '█';
    private static final int cellSize = 100;
    private static final int cellBorder = 2;
    private static final int fontSize = 80;

    private final Crossword crossword;

    public Renderer(Crossword crossword) {
        this.crossword = crossword;
    }

    /**
     * @return a height x width array holding the letter the assignment places on each square,
     * or null for squares no assigned word covers
     */
    public Character[][] letterGrid(Assignment assignment) {
        Character[][] letters = new Character[crossword.height()][crossword.width()];
        for (Map.Entry<Variable, String> e : assignment.asMap().entrySet()) {
            List<int[]> cells = e.getKey().cells();
            String word = e.getValue();
            for (int k = 0; k < word.length() && k < cells.size(); ++k) {
                int[] c = cells.get(k);
                letters[c[0]][c[1]] = word.charAt(k);
            }
        }
        return letters;
    }

    /**
     * @return the grid as text, one line per row: letters on open squares (blank if
     * unassigned) and a solid block on blocked squares
     */
    public String toText(Assignment assignment) {
        Character[][] letters = letterGrid(assignment);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < crossword.height(); ++i) {
            for (int j = 0; j < crossword.width(); ++j) {
                if (crossword.isOpen(i, j)) sb.append(letters[i][j] != null ? letters[i][j] : ' ');
                else sb.append(BLOCKED);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * @return the grid drawn with {@value #cellSize} px squares: open squares white inside a
     * {@value #cellBorder} px black border, blocked squares solid black
     */
    public BufferedImage toImage(Assignment assignment) {
        Character[][] letters = letterGrid(assignment);
        BufferedImage img = new BufferedImage(
                crossword.width() * cellSize, crossword.height() * cellSize, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, img.getWidth(), img.getHeight());
            FontMetrics fm = null;  // fonts are only loaded once there is a letter to draw
            final int interior = cellSize - 2 * cellBorder;
            for (int i = 0; i < crossword.height(); ++i) {
                for (int j = 0; j < crossword.width(); ++j) {
                    if (!crossword.isOpen(i, j)) continue;
                    int x = j * cellSize + cellBorder;
                    int y = i * cellSize + cellBorder;
                    g.setColor(Color.WHITE);
                    g.fillRect(x, y, interior, interior);
                    if (letters[i][j] == null) continue;
                    if (fm == null) {
                        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, fontSize));
                        fm = g.getFontMetrics();
                    }
                    String s = String.valueOf(letters[i][j]);
                    g.setColor(Color.BLACK);
                    g.drawString(s,
                            x + (interior - fm.stringWidth(s)) / 2,
                            y + (interior - fm.getHeight()) / 2 + fm.getAscent());
                }
            }
        } finally {
            g.dispose();
        }
        return img;
    }

    /**
     * Write the filled grid to a PNG file.
     */
    public void save(Assignment assignment, File file) throws IOException {
        if (!ImageIO.write(toImage(assignment), "png", file)) {
            throw new IOException("no PNG writer available for " + file);
        }
    }
}

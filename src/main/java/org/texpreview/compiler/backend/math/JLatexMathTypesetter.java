package org.texpreview.compiler.backend.math;

import org.scilab.forge.jlatexmath.ParseException;
import org.scilab.forge.jlatexmath.TeXConstants;
import org.scilab.forge.jlatexmath.TeXFormula;
import org.scilab.forge.jlatexmath.TeXIcon;
import org.texpreview.compiler.diagnostics.CompilerLogger;

import javax.imageio.ImageIO;
import javax.swing.JLabel;
import java.awt.AWTError;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Insets;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * Typesets formulas with JLaTeXMath and encodes them as PNG data URIs.
 */
public class JLatexMathTypesetter implements IMathTypesetter {

    private static final String PNG_PREFIX = "data:image/png;base64,";

    private final float fontSize;

    /**
     * @param fontSize The point size of the rendered formula.
     */
    public JLatexMathTypesetter(float fontSize) {
        this.fontSize = fontSize;
    }

    @Override
    public TypesetResult typeset(String latex, boolean display) {
        try {
            TeXFormula formula = new TeXFormula(latex);
            TeXIcon icon = formula.createTeXIcon(display ? TeXConstants.STYLE_DISPLAY : TeXConstants.STYLE_TEXT, fontSize);
            icon.setInsets(new Insets(2, 2, 2, 2));
            int width = Math.max(1, icon.getIconWidth());
            int height = Math.max(1, icon.getIconHeight());

            BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
            Graphics2D g2 = image.createGraphics();
            try {
                JLabel label = new JLabel();
                label.setForeground(Color.BLACK);
                icon.paintIcon(label, g2, 0, 0);
            } finally {
                g2.dispose();
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (!ImageIO.write(image, "png", out)) {
                return TypesetResult.failure("no PNG writer available");
            }
            return TypesetResult.success(PNG_PREFIX + Base64.getEncoder().encodeToString(out.toByteArray()), width, height);
        } catch (ParseException e) {
            CompilerLogger.debug("JLatexMathTypesetter: cannot parse '{}': {}", latex, e.getMessage());
            return TypesetResult.failure(e.getMessage());
        } catch (IOException e) {
            CompilerLogger.warn("JLatexMathTypesetter: PNG encoding failed: {}", e.getMessage());
            return TypesetResult.failure(e.getMessage());
        } catch (RuntimeException | LinkageError | AWTError e) {
            CompilerLogger.warn("JLatexMathTypesetter: typesetting '{}' failed: {}", latex, e.toString());
            return TypesetResult.failure(e.toString());
        }
    }
}

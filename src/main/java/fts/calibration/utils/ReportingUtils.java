package fts.calibration.utils;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.jfree.chart.JFreeChart;

/**
 * Functions for creating PDF reports out of charts and text. These methods are all static.
 */
public class ReportingUtils {

  private static final Logger logger = Logger.getLogger(ReportingUtils.class);

  static final float FONT_SIZE = 10;
  static final float MARGIN = 72;
  private static final PDFont PDF_FONT = PDType1Font.COURIER;

  private ReportingUtils() {
  }

  /**
   * Write a PDF report with one page per chart followed by the text, which is paginated
   *
   * @param file Destination file
   * @param width Width of each chart image in pixels
   * @param height Height of each chart image in pixels
   * @param text Text to write after the charts
   * @param charts Charts to write, one per page
   * @throws IOException If the document cannot be built or saved
   */
  public static void writeReport(File file, int width, int height, String text,
      JFreeChart... charts) throws IOException {
    try (PDDocument pdf = new PDDocument()) {
      for (JFreeChart chart : charts) {
        bufferedImageToPDFPage(chart.createBufferedImage(width, height), pdf);
      }
      textToPDFPages(text, pdf);
      pdf.save(file);
    }
    logger.info("Report written to " + file.getPath());
  }

  /**
   * Add a buffered image to a new PDDocument page sized to fit it
   *
   * @param bi BufferedImage to be added to PDF
   * @param pdf PDF to have BufferedImage appended to
   * @throws IOException If the image cannot be encoded
   */
  public static void bufferedImageToPDFPage(BufferedImage bi, PDDocument pdf)
      throws IOException {
    PDPage page = new PDPage(new PDRectangle(bi.getWidth(), bi.getHeight()));
    PDImageXObject pdImageXObject = LosslessFactory.createFromImage(pdf, bi);
    pdf.addPage(page);
    try (PDPageContentStream contentStream = new PDPageContentStream(pdf, page,
        PDPageContentStream.AppendMode.OVERWRITE, true, false)) {
      contentStream.drawImage(pdImageXObject, 0, 0, bi.getWidth(), bi.getHeight());
    }
  }

  /**
   * Add pages of text to a PDF document. Long rows are wrapped at spaces and as many pages are
   * added as the text needs. Nothing is added for empty text.
   *
   * @param toWrite Text to add
   * @param pdf Document to append the pages to
   * @return Number of pages added
   * @throws IOException If the text cannot be laid out in the document font
   */
  public static int textToPDFPages(String toWrite, PDDocument pdf) throws IOException {
    if (toWrite.length() == 0) {
      return 0;
    }

    PDRectangle mediaBox = PDRectangle.LETTER;
    float leading = 1.5f * FONT_SIZE;
    float width = mediaBox.getWidth() - 2 * MARGIN;
    float startX = mediaBox.getLowerLeftX() + MARGIN;
    float startY = mediaBox.getUpperRightY() - MARGIN;
    int linesPerPage = (int) ((mediaBox.getHeight() - 2 * MARGIN) / leading);

    List<String> lines = wrapText(toWrite, width);
    int pages = 0;
    for (int start = 0; start < lines.size(); start += linesPerPage) {
      PDPage page = new PDPage(mediaBox);
      pdf.addPage(page);
      ++pages;
      try (PDPageContentStream contentStream = new PDPageContentStream(pdf, page)) {
        contentStream.beginText();
        contentStream.setFont(PDF_FONT, FONT_SIZE);
        contentStream.newLineAtOffset(startX, startY);
        int end = Math.min(start + linesPerPage, lines.size());
        for (String line : lines.subList(start, end)) {
          contentStream.showText(line);
          contentStream.newLineAtOffset(0, -leading);
        }
        contentStream.endText();
      }
    }
    return pages;
  }

  /**
   * Split text into rows no wider than the given width in the report font, breaking at spaces
   * where possible
   *
   * @param toWrite Text to split; existing newlines are kept as row breaks
   * @param width Maximum row width in points
   * @return Rows of text
   * @throws IOException If a string width cannot be measured
   */
  static List<String> wrapText(String toWrite, float width) throws IOException {
    List<String> lines = new ArrayList<>();
    for (String text : toWrite.split("\n")) {
      if (text.isEmpty()) {
        lines.add("");
        continue;
      }
      int lastSpace = -1;
      while (text.length() > 0) {
        int spaceIndex = text.indexOf(' ', lastSpace + 1);
        if (spaceIndex < 0) {
          spaceIndex = text.length();
        }
        String subString = text.substring(0, spaceIndex);
        float size = FONT_SIZE * PDF_FONT.getStringWidth(subString) / 1000;
        if (size > width) {
          if (lastSpace < 0) {
            lastSpace = spaceIndex;
          }
          lines.add(text.substring(0, lastSpace));
          text = text.substring(lastSpace).trim();
          lastSpace = -1;
        } else if (spaceIndex == text.length()) {
          lines.add(text);
          text = "";
        } else {
          lastSpace = spaceIndex;
        }
      }
    }
    return lines;
  }
}

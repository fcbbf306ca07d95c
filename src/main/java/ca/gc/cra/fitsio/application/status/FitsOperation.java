package ca.gc.cra.fitsio.application.status;

/**
 * Operation context passed to {@link StatusTranslator}; selects the exception type for a failure and
 * names the operation in its message.
 */
public enum FitsOperation {
  OPEN("open file"),
  CREATE("create file"),
  CLOSE("close file"),
  MOVE("move to HDU"),
  QUERY("query HDU"),
  COLUMN_LOOKUP("look up column"),
  COLUMN_READ("read column"),
  COLUMN_WRITE("write column"),
  IMAGE_READ("read image"),
  IMAGE_WRITE("write image"),
  STRUCTURE("modify structure"),
  HEADER_READ("read keyword"),
  HEADER_WRITE("write keyword");

  private final String label;

  FitsOperation(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}

package oprec;

import java.util.Comparator;
import java.util.Objects;

public final class Pos implements Comparable<Pos> {
  private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

  private static final Comparator<Pos> ORDER =
      Comparator.comparing(Pos::file).thenComparing(Pos::lineNumber).thenComparing(Pos::column);

  public static Pos internal() {
    return INTERNAL;
  }

  private final String file;
  private final int lineNumber;
  private final int column;

  public Pos(String file, int lineNumber, int column) {
    this.file = Objects.requireNonNull(file);
    this.lineNumber = lineNumber;
    this.column = column;
  }

  public String file() {
    return file;
  }

  public int lineNumber() {
    return lineNumber;
  }

  public int column() {
    return column;
  }

  public boolean isInternal() {
    return equals(INTERNAL);
  }

  @Override
  public int compareTo(Pos pos) {
    return ORDER.compare(this, pos);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Pos)) return false;
    Pos that = (Pos) obj;
    return file.equals(that.file) && lineNumber == that.lineNumber && column == that.column;
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, lineNumber, column);
  }

  @Override
  public String toString() {
    if (isInternal()) return file;
    return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
  }
}

package ca.gc.cra.fitsio.domain.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class ColumnDescriptionTest {

  @Test
  void parsesScalarTform() {
    ColumnDescription column = ColumnDescription.fromTform("FLUX", "E");

    assertEquals(ColumnDataType.FLOAT, column.type());
    assertEquals(1, column.repeat());
    assertEquals(4, column.width());
    assertEquals(1, column.elementsPerRow());
    assertEquals("1E", column.tform());
  }

  @Test
  void parsesVectorTform() {
    ColumnDescription column = ColumnDescription.fromTform("SPECTRUM", "3D");

    assertEquals(ColumnDataType.DOUBLE, column.type());
    assertEquals(3, column.elementsPerRow());
    assertEquals("3D", column.tform());
  }

  @Test
  void stringColumnHoldsOneStringPerRow() {
    ColumnDescription column = ColumnDescription.fromTform("NAME", "10A");

    assertEquals(10, column.width());
    assertEquals(1, column.elementsPerRow());
    assertEquals("10A", column.tform());
  }

  @Test
  void splitStringColumnHoldsSeveralStringsPerRow() {
    ColumnDescription column = ColumnDescription.fromTform("TAGS", "20A5");

    assertEquals(20, column.repeat());
    assertEquals(5, column.width());
    assertEquals(4, column.elementsPerRow());
    assertEquals("20A5", column.tform());
  }

  @Test
  void builderKeepsUnitAndDropsBlankUnit() {
    ColumnDescription withUnit = ColumnDescription.builder("TIME")
        .type(ColumnDataType.DOUBLE)
        .unit("s")
        .build();
    ColumnDescription blank = ColumnDescription.builder("TIME")
        .type(ColumnDataType.DOUBLE)
        .unit("  ")
        .build();

    assertEquals(Optional.of("s"), withUnit.unit());
    assertEquals(Optional.empty(), blank.unit());
    assertEquals("TIME(1D, s)", withUnit.toString());
  }

  @Test
  void renamingKeepsLayout() {
    ColumnDescription column = ColumnDescription.fromTform("a", "4J");
    ColumnDescription renamed = column.withName("b");

    assertEquals("b", renamed.name());
    assertEquals(column.tform(), renamed.tform());
    assertEquals(ColumnDescription.fromTform("b", "4J"), renamed);
  }

  @Test
  void rejectsBadDefinitions() {
    assertThrows(IllegalArgumentException.class, () -> ColumnDescription.fromTform("X", "1Q"));
    assertThrows(IllegalArgumentException.class, () -> ColumnDescription.fromTform("X", "E4E"));
    assertThrows(IllegalArgumentException.class, () -> ColumnDescription.fromTform(" ", "E"));
    assertThrows(IllegalArgumentException.class,
        () -> ColumnDescription.builder("X").type(ColumnDataType.INT).repeat(0));
    IllegalStateException untyped = assertThrows(IllegalStateException.class,
        () -> ColumnDescription.builder("X").build());
    assertTrue(untyped.getMessage().contains("X"));
  }

  @Test
  void tformCodesAreCaseInsensitive() {
    assertEquals(Optional.of(ColumnDataType.LONG), ColumnDataType.fromTformCode('k'));
    assertEquals(Optional.empty(), ColumnDataType.fromTformCode('C'));
  }
}

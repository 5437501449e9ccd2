package org.dbms.dsource;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.apache.arrow.dataset.file.DatasetFileWriter;
import org.apache.arrow.dataset.file.FileFormat;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.dbms.dsource.config.SourceOptions;
import org.dbms.dtype.FieldNotFoundException;
import org.dbms.dtype.RecordBatch;
import org.dbms.dtype.UnsupportedTypeException;
import org.junit.jupiter.api.Test;

public class ParquetDataSourceTest extends DataSourceContract {

  // Fixture writes go through Arrow's native writer, which returns exported buffers to this
  // allocator some time after the write completes; it is never closed so scans can be measured
  // against the per-test allocator alone.
  private static final BufferAllocator FIXTURES = new RootAllocator();

  /** Writes the given vectors as a single Parquet file and returns its path. */
  private Path writeParquet(String name, List<FieldVector> vectors, int rowCount)
      throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (VectorSchemaRoot root = new VectorSchemaRoot(vectors)) {
      root.setRowCount(rowCount);
      try (ArrowStreamWriter writer =
          new ArrowStreamWriter(
              root, new DictionaryProvider.MapDictionaryProvider(), Channels.newChannel(out))) {
        writer.start();
        writer.writeBatch();
        writer.end();
      }
    }
    Path dir = tempDir.resolve(name);
    try (ArrowStreamReader reader =
        new ArrowStreamReader(new ByteArrayInputStream(out.toByteArray()), FIXTURES)) {
      DatasetFileWriter.write(FIXTURES, reader, FileFormat.PARQUET, dir.toUri().toString());
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files.filter(Files::isRegularFile).findFirst().orElseThrow();
    }
  }

  private List<FieldVector> peopleVectors() {
    BigIntVector ids = new BigIntVector("id", FIXTURES);
    VarCharVector names = new VarCharVector("name", FIXTURES);
    BigIntVector ages = new BigIntVector("age", FIXTURES);
    ids.allocateNew(3);
    names.allocateNew(3);
    ages.allocateNew(3);
    String[] people = {"Alice", "Bob", "Carol"};
    long[] years = {30, 25, 35};
    for (int i = 0; i < 3; i++) {
      ids.set(i, i + 1);
      names.set(i, people[i].getBytes(StandardCharsets.UTF_8));
      ages.set(i, years[i]);
    }
    return List.of(ids, names, ages);
  }

  private Path peopleParquet() throws IOException {
    return writeParquet("people", peopleVectors(), 3);
  }

  @Override
  DataSource people() throws IOException {
    return new ParquetDataSource(peopleParquet(), 1024, allocator);
  }

  @Test
  void projectsTwoColumns() throws IOException {
    ParquetDataSource source = new ParquetDataSource(peopleParquet(), 1024, allocator);
    long rows = 0;
    try (RecordBatchStream stream = source.scan(List.of("name", "age"))) {
      while (stream.hasNext()) {
        try (RecordBatch batch = stream.next()) {
          assertEquals(2, batch.columnCount());
          assertEquals("name", batch.schema().field(0).name());
          rows += batch.rowCount();
        }
      }
    }
    assertEquals(3, rows);
  }

  @Test
  void batchSizeBoundsRowsPerBatch() throws IOException {
    ParquetDataSource source = new ParquetDataSource(peopleParquet(), 2, allocator);
    try (RecordBatchStream stream = source.scan()) {
      while (stream.hasNext()) {
        try (RecordBatch batch = stream.next()) {
          assertTrue(batch.rowCount() <= 2);
        }
      }
      assertEquals(3, stream.rowCount());
    }
  }

  @Test
  void lenientProjectionDropsUnknownNames() throws IOException {
    SourceOptions lenient = SourceOptions.builder().strictProjection(false).build();
    ParquetDataSource source = new ParquetDataSource(peopleParquet(), lenient, allocator);
    assertEquals(
        List.of(List.of("Alice", 30L), List.of("Bob", 25L), List.of("Carol", 35L)),
        rows(source, List.of("name", "ghost", "age")));
  }

  @Test
  void strictProjectionIsDefault() throws IOException {
    ParquetDataSource source =
        new ParquetDataSource(peopleParquet(), SourceOptions.defaults(), allocator);
    assertThrows(FieldNotFoundException.class, () -> source.scan(List.of("ghost")));
  }

  @Test
  void unsupportedColumnFailsSchemaButCanBeProjectedAway() throws IOException {
    VarCharVector names = new VarCharVector("name", FIXTURES);
    DateDayVector days = new DateDayVector("joined", FIXTURES);
    names.allocateNew(1);
    days.allocateNew(1);
    names.set(0, "Alice".getBytes(StandardCharsets.UTF_8));
    days.set(0, 19000);
    Path file = writeParquet("dated", List.of(names, days), 1);

    ParquetDataSource source = new ParquetDataSource(file, 1024, allocator);
    assertThrows(UnsupportedTypeException.class, source::schema);
    assertThrows(UnsupportedTypeException.class, source::scan);
    assertThrows(UnsupportedTypeException.class, () -> source.scan(List.of("joined")));
    assertEquals(List.of(List.of("Alice")), rows(source, List.of("name")));
  }

  @Test
  void missingFileFails() {
    ParquetDataSource source =
        new ParquetDataSource(tempDir.resolve("missing.parquet"), 1024, allocator);
    assertThrows(DataSourceIoException.class, source::schema);
    assertThrows(DataSourceIoException.class, source::scan);
  }
}

package se.alipsa.dbext.local;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.InputRow;

/** Reads the input of a pivot from a Parquet file. */
public final class ParquetRowSource {

  private static final Logger log = LoggerFactory.getLogger(ParquetRowSource.class);

  private final Path path;
  private final Configuration conf;

  /**
   * Create a source for a local file.
   *
   * @param file
   *          the Parquet file
   */
  public ParquetRowSource(File file) {
    this(new Path(file.toURI()), new Configuration(false));
  }

  /**
   * Create a source.
   *
   * @param path
   *          the Parquet file
   * @param conf
   *          the Hadoop configuration used to open it
   */
  public ParquetRowSource(Path path, Configuration conf) {
    this.path = Objects.requireNonNull(path, "path");
    this.conf = Objects.requireNonNull(conf, "conf");
  }

  /**
   * The Avro schema of the file, taken from the writer's metadata when present and derived from the
   * Parquet schema otherwise.
   *
   * @return the record schema
   * @throws IOException
   *           if the footer cannot be read
   */
  public Schema avroSchema() throws IOException {
    try (ParquetFileReader reader = ParquetFileReader.open(HadoopInputFile.fromPath(path, conf))) {
      var meta = reader.getFooter().getFileMetaData();
      Map<String, String> kv = meta.getKeyValueMetaData();
      String avroJson = kv.get("parquet.avro.schema");
      if (avroJson == null) {
        avroJson = kv.get("avro.schema");
      }
      if (avroJson != null && !avroJson.isEmpty()) {
        return new Schema.Parser().parse(avroJson);
      }
      return new AvroSchemaConverter(conf).convert(meta.getSchema());
    }
  }

  /**
   * The input columns.
   *
   * @return one column per field of the file schema
   * @throws IOException
   *           if the footer cannot be read
   */
  public List<ColumnDesc> columns() throws IOException {
    return AvroColumnTypes.columns(avroSchema());
  }

  /**
   * Read every row of the file.
   *
   * @return the rows in file order
   * @throws IOException
   *           if the file cannot be read
   */
  public List<InputRow> readRows() throws IOException {
    List<InputRow> rows = new ArrayList<>();
    try (ParquetReader<GenericRecord> reader = AvroParquetReader
        .<GenericRecord>builder(HadoopInputFile.fromPath(path, conf)).build()) {
      GenericRecord rec;
      while ((rec = reader.read()) != null) {
        rows.add(AvroRows.toInputRow(rec));
      }
    }
    log.debug("Read {} rows from {}", rows.size(), path);
    return rows;
  }
}

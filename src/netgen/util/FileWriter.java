package netgen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** key: file relative path; value: content, in registration order */
  private LinkedHashMap<String, StringBuilder> update_core = new LinkedHashMap<String, StringBuilder>();
  public String tab = "    ";
  private String base_path = "";
  public FileWriter(String base_path) { this.base_path = base_path; }

  /**
   * Appends text to a file to be written later.
   *
   * @param file The relative path to the file. The path string should be equal for all updates that target the same file.
   * @param text The text to append; use "\n" line breaks for multi-line text.
   */
  public void UpdateContent(String file, String text) { update_core.computeIfAbsent(file, file_ -> new StringBuilder()).append(text); }

  /** Registered file paths, in registration order. */
  public Set<String> GetFiles() { return update_core.keySet(); }

  /**
   * Writes all registered files below the base path, creating directories as needed. Each file is written as a whole; a failure is
   * not retried and files already written are left in place.
   *
   * @return the written paths, in registration order
   * @throws IOException if a directory or file cannot be written
   */
  public List<Path> WriteFiles() throws IOException {
    List<Path> written = new ArrayList<>();
    for (String file : update_core.keySet()) {
      Path outFile = Paths.get(base_path, file);
      if (outFile.getParent() != null)
        Files.createDirectories(outFile.getParent());
      logger.info("Writing " + outFile);
      Files.writeString(outFile, update_core.get(file), StandardCharsets.UTF_8);
      written.add(outFile);
    }
    return written;
  }
}

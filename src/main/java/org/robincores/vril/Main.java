package org.robincores.vril;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Scanner;

import org.robincores.vril.ir.Program;
import org.robincores.vril.json.ProgramJson;
import org.robincores.vril.text.VrilText;

/**
 * Command-line front end.
 * <pre>
 *   vril2json   text on stdin  -> JSON on stdout
 *   vril2txt    JSON on stdin  -> text on stdout
 * </pre>
 * Exit status: 0 on success, 1 on bad usage, 2 when the input cannot be converted.
 */
public class Main {
  public static final String VERSION = "0.0.1";

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_FAILED = 2;

  private static final String SOURCE = "<stdin>";

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out, System.err));
  }

  static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    if (args.length != 1) {
      usage(err);
      return EXIT_USAGE;
    }

    try {
      switch (args[0]) {
        case "vril2json": {
          Program program = VrilText.parse(readAll(in));
          out.println(ProgramJson.encode(program));
          return EXIT_OK;
        }

        case "vril2txt": {
          Program program = ProgramJson.decode(readAll(in));
          out.print(VrilText.format(program));
          return EXIT_OK;
        }

        case "--version":
          out.println("vril " + VERSION);
          return EXIT_OK;

        default:
          err.println("Unknown command: " + args[0]);
          usage(err);
          return EXIT_USAGE;
      }
    } catch (ConversionException e) {
      // Nothing has been written to out at this point
      if (e.hasPosition()) {
        err.println(SOURCE + "(" + e.line() + ":" + e.column() + "): " + e.reason());
      } else {
        err.println(SOURCE + ": " + e.reason());
      }
      return EXIT_FAILED;
    } catch (IOException e) {
      err.println(SOURCE + ": Error reading input: " + e.getMessage());
      return EXIT_FAILED;
    }
  }

  static void usage(PrintStream err) {
    err.println("Usage: vril <vril2json|vril2txt|--version>  (reads stdin, writes stdout)");
  }

  // Reads the entire stream; Scanner stops quietly on a read failure, so rethrow it
  static String readAll(InputStream in) throws IOException {
    Scanner scanner = new Scanner(in, StandardCharsets.UTF_8.name());
    scanner.useDelimiter("\\A");
    String text = scanner.hasNext() ? scanner.next() : "";
    if (scanner.ioException() != null) {
      throw scanner.ioException();
    }
    return text;
  }
}

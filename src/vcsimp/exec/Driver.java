package vcsimp.exec;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileOutputStream;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintStream;

import vcsimp.hir.PrintTools;
import vcsimp.hir.Tools;

/**
 * Holds the option set shared by the simplifier components and implements
 * the command line front end that manipulates it. Embedding code reads and
 * writes options through {@link #getOptionValue(String)} and
 * {@link #setOptionValue(String, String)}.
 * <p>
 * There is no input format for verification conditions, so the command line
 * only validates, loads, dumps and reports options. Simplification is run by
 * the embedding verifier through
 * {@link vcsimp.transforms.SimplificationPass} or
 * {@link vcsimp.transforms.ExpSimplifier}, which read the options set here.
 */
public class Driver
{
  /** Name of the options file looked up by load-options. */
  public static final String OPTIONS_FILE = "options.vcsimp";

  /** Registered options and their current values. */
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  static {
    registerOptions();
  }

  protected Driver()
  {
  }

  /**
   * Registers all options with their default values. Options without a
   * default are unset until given on the command line.
   */
  public static void registerOptions()
  {
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see (default is 0)");
    options.add(options.UTILITY, "dump-options",
                "Create file " + OPTIONS_FILE + " with default options");
    options.add(options.UTILITY, "load-options",
                "Load options from file " + OPTIONS_FILE
                + " in the working or home directory");
    options.add(options.SIMPLIFY, "spec-mode", "1", "0|1",
                "Enable rules that are only sound for specification expressions\n"
                + "      =0 Disable arithmetic normalization and freeze removal\n"
                + "      =1 Enable them (default)");
    options.add(options.SIMPLIFY, "max-unfold-depth", "10", "N",
                "Maximum nesting of spec function unfolding on constant arguments (default is 10)");
    options.add(options.SIMPLIFY, "skip-quantifiers",
                "Leave forall and exists nodes untouched by the quantifier rules");
  }

  /**
   * Looks up an option.
   *
   * @return the current value, or null for an unset option or unknown name.
   */
  public static String getOptionValue(String key)
  {
    return options.getValue(key);
  }

  /**
   * Changes an option. A null value unsets it; unknown names are ignored.
   */
  public static void setOptionValue(String key, String value)
  {
    options.setValue(key, value);
    if (key.equals("verbosity"))
      PrintTools.updateVerbosity();
  }

  /**
   * Returns the integer value of an option, or the given default if the
   * option is unset.
   */
  public static int getIntOption(String key, int default_value)
  {
    String value = getOptionValue(key);
    if (value == null)
      return default_value;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "option " + key + " expects an integer: " + value, e);
    }
  }

  /** Returns true if the flag is set to anything other than "0". */
  public static boolean isOptionSet(String key)
  {
    String value = getOptionValue(key);
    return value != null && !value.trim().equals("0");
  }

  /**
   * Parses one line of an options file, either "name" or "name=value".
   */
  protected void parseOption(String opt)
  {
    opt = opt.trim();
    if (opt.length() < 2)
      return;
    int eq = opt.indexOf('=');
    String option_name = (eq == -1) ? opt : opt.substring(0, eq);
    if (!options.contains(option_name)) {
      System.err.println("ignoring unrecognized option " + option_name);
      return;
    }
    if (eq == -1)
      setOptionValue(option_name, "1");
    else
      setOptionValue(option_name, opt.substring(eq + 1));
  }

  /**
   * Applies arguments of the form -name or -name=value. Anything else
   * prints the usage and exits with status 1.
   */
  protected void parseCommandLine(String[] args)
  {
    for (String arg : args) {
      if (arg.length() < 2 || arg.charAt(0) != '-') {
        System.err.println("unexpected argument " + arg);
        printUsage();
        Tools.exit(1);
        return;
      }
      int eq = arg.indexOf('=');
      String option_name = (eq == -1) ? arg.substring(1) : arg.substring(1, eq);
      if (!options.contains(option_name)) {
        System.err.println("unrecognized option " + option_name);
        printUsage();
        Tools.exit(1);
        return;
      }
      // bare flag means "1"
      setOptionValue(option_name, (eq == -1) ? "1" : arg.substring(eq + 1));
    }
  }

  /**
   * Prints the list of options that the simplifier accepts.
   */
  public void printUsage()
  {
    String usage = "\nvcsimp.exec.Driver [option]...\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

  /**
   * Dumps default options to file options.vcsimp in the working directory.
   * An existing file is not overwritten.
   */
  public void dumpOptionsFile()
  {
    File optionsFile = new File(OPTIONS_FILE);
    try {
      if (optionsFile.createNewFile()) {
        PrintStream ps = new PrintStream(new FileOutputStream(optionsFile));
        try {
          ps.println(options.dumpOptions().trim());
        } finally {
          ps.close();
        }
      }
    } catch (IOException e) {
      System.err.println("Error: Failed to dump " + OPTIONS_FILE + ": " + e);
      Tools.exit(1);
    }
  }

  /**
   * Loads options.vcsimp, searching the working directory and then the
   * home directory.
   */
  public void loadOptionsFile()
  {
    File optionsFile = new File(OPTIONS_FILE);
    if (!optionsFile.exists()) {
      optionsFile = new File(System.getProperty("user.home"), OPTIONS_FILE);
    }
    if (!optionsFile.exists()) {
      System.err.println("Error: Failed to load " + OPTIONS_FILE);
      System.err.println("Use option -dump-options to create " + OPTIONS_FILE
                         + " with default values");
      Tools.exit(1);
      return;
    }
    try {
      BufferedReader br = new BufferedReader(new FileReader(optionsFile));
      try {
        String line;
        while ((line = br.readLine()) != null) {
          if (line.startsWith("#"))
            continue;
          parseOption(line);
        }
      } finally {
        br.close();
      }
    } catch (IOException e) {
      System.err.println("Error while loading options file: " + e);
      Tools.exit(1);
    }
  }

  /**
   * Applies the command line. A requested options file is read before the
   * explicit arguments, which take precedence over it.
   */
  public void run(String[] args)
  {
    for (String arg : args) {
      if (arg.equals("-load-options")) {
        loadOptionsFile();
        break;
      }
    }
    parseCommandLine(args);

    if (getOptionValue("help") != null) {
      printUsage();
      Tools.exit(0);
      return;
    }
    if (getOptionValue("dump-options") != null) {
      setOptionValue("dump-options", null);
      setOptionValue("load-options", null);
      dumpOptionsFile();
    }
    PrintTools.printlnStatus(1, "[Driver] verbosity =", getOptionValue("verbosity"),
        "spec-mode =", getOptionValue("spec-mode"),
        "max-unfold-depth =", getOptionValue("max-unfold-depth"));
  }

  /**
   * Command line entry. Applies and reports the options; it does not read or
   * simplify any expressions.
   */
  public static void main(String[] args)
  {
    (new Driver()).run(args);
  }
}

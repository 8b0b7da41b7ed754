package vcsimp.exec;

import java.util.Map;
import java.util.TreeMap;

import vcsimp.hir.PrintTools;

/**
 * Registry of named options with default values, argument hints, usage text
 * and a category used to group the usage listing.
 */
public class CommandLineOptionSet
{
  public final int UTILITY = 1;
  public final int SIMPLIFY = 2;

  private class OptionRecord
  {
    public int option_type;
    public String value;
    public String arg;
    public String usage;

    public OptionRecord(int type, String value, String arg, String usage)
    {
      this.option_type = type;
      this.value = value;
      this.arg = arg;
      this.usage = usage;
    }
  }

  private TreeMap<String, OptionRecord> name_to_record;

  public CommandLineOptionSet()
  {
    name_to_record = new TreeMap<String, OptionRecord>();
  }

  /** Adds a flag without a value. */
  public void add(int type, String name, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, null, null, usage));
  }

  /** Adds an option taking an argument but without a default. */
  public void add(int type, String name, String arg, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, null, arg, usage));
  }

  /** Adds an option with a default value. */
  public void add(int type, String name, String value, String arg, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, value, arg, usage));
  }

  public boolean contains(String name)
  {
    return name_to_record.containsKey(name);
  }

  /**
   * Returns the contents of an options file: every option with its usage
   * as comment lines followed by a line with the current value.
   */
  public String dumpOptions()
  {
    StringBuilder sb = new StringBuilder(2000);
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      OptionRecord record = entry.getValue();
      sb.append("#Option: ").append(entry.getKey()).append("\n#");
      sb.append(entry.getKey());
      if (record.arg != null) {
        sb.append("=").append(record.arg);
      }
      sb.append("\n#").append(record.usage.replaceAll("\n", "\n#"));
      sb.append("\n");
      // valueless flags stay commented out
      if (record.value == null && record.arg == null) {
        sb.append("#");
      }
      sb.append(entry.getKey());
      if (record.value != null) {
        sb.append("=").append(record.value);
      }
      sb.append("\n");
    }
    return sb.toString();
  }

  public String getUsage()
  {
    StringBuilder sb = new StringBuilder(4000);
    appendHeading(sb, "UTILITY");
    sb.append(getUsage(UTILITY));
    appendHeading(sb, "SIMPLIFY");
    sb.append(getUsage(SIMPLIFY));
    return sb.toString();
  }

  private static void appendHeading(StringBuilder sb, String title)
  {
    String sep = PrintTools.line_sep;
    String rule = String.format("%80s", "").replace(' ', '-');
    sb.append(rule).append(sep).append(title).append(sep);
    sb.append(rule).append(sep);
  }

  public String getUsage(int type)
  {
    StringBuilder sb = new StringBuilder(2000);
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      OptionRecord record = entry.getValue();
      if (record.option_type == type) {
        sb.append("-").append(entry.getKey());
        if (record.arg != null) {
          sb.append("=").append(record.arg);
        }
        sb.append("\n    ").append(record.usage).append("\n\n");
      }
    }
    return sb.toString();
  }

  public String getValue(String name)
  {
    OptionRecord record = name_to_record.get(name);
    if (record == null)
      return null;
    else
      return record.value;
  }

  public void setValue(String name, String value)
  {
    OptionRecord record = name_to_record.get(name);
    if (record != null)
      record.value = value;
  }

  public int getType(String name)
  {
    OptionRecord record = name_to_record.get(name);
    if (record == null)
      return 0;
    else
      return record.option_type;
  }
}

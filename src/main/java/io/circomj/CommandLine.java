/*
 * Copyright © 2022,2023 James Crawford
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package io.circomj;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Options given to the circomj command.
 * <p>Flags (-p, -u, -v) can be grouped as in "-pv". Options with a value (-e, -f, -m) take
 * it either from the rest of the same argument ("-f3") or from the next argument. An
 * argument of "--" ends the options so that files whose names start with '-' can be given.</p>
 */
class CommandLine {
  private static final String FLAGS  = "puv";
  private static final String VALUED = "efm";

  boolean      print;          // -p
  boolean      uninitialised;  // -u
  boolean      verbose;        // -v
  String       source;         // -e
  String       fileId;         // -f
  String       modulus;        // -m
  List<String> files = new ArrayList<>();

  private CommandLine() {}

  /**
   * @throws IllegalArgumentException with the usage appended if the arguments are invalid,
   *                                  or with just the usage for -h
   */
  static CommandLine parse(String[] args, String usage) {
    CommandLine    commandLine = new CommandLine();
    Set<Character> seen        = new HashSet<>();
    int i = 0;
    for (; i < args.length && !args[i].equals("--"); i++) {
      String arg = args[i];
      if (arg.length() < 2 || arg.charAt(0) != '-') {
        commandLine.files.add(arg);
        continue;
      }
      for (int pos = 1; pos < arg.length(); pos++) {
        char option = arg.charAt(pos);
        if (option == 'h') {
          throw new IllegalArgumentException(usage);
        }
        if (FLAGS.indexOf(option) == -1 && VALUED.indexOf(option) == -1) {
          throw new IllegalArgumentException("Unknown option '-" + option + "'\n" + usage);
        }
        if (!seen.add(option)) {
          throw new IllegalArgumentException("Option '-" + option + "' given more than once\n" + usage);
        }
        if (FLAGS.indexOf(option) != -1) {
          commandLine.setFlag(option);
          continue;
        }
        String value;
        if (pos + 1 < arg.length()) {
          value = arg.substring(pos + 1);
        }
        else if (i + 1 < args.length) {
          value = args[++i];
        }
        else {
          throw new IllegalArgumentException("Missing value for option '-" + option + "'\n" + usage);
        }
        commandLine.setValue(option, value);
        break;
      }
    }
    // Everything after "--" is a file
    for (i++; i < args.length; i++) {
      commandLine.files.add(args[i]);
    }
    return commandLine;
  }

  private void setFlag(char flag) {
    switch (flag) {
      case 'p': print         = true; break;
      case 'u': uninitialised = true; break;
      case 'v': verbose       = true; break;
      default:  throw new IllegalStateException("Internal error: unexpected flag " + flag);
    }
  }

  private void setValue(char option, String value) {
    switch (option) {
      case 'e': source  = value; break;
      case 'f': fileId  = value; break;
      case 'm': modulus = value; break;
      default:  throw new IllegalStateException("Internal error: unexpected option " + option);
    }
  }
}

/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.planar;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.compile.ContractionPlan;
import net.hydromatic.planar.compile.PlanarCompiler;
import net.hydromatic.planar.compile.Tracers;
import net.hydromatic.planar.eval.Prop;
import net.hydromatic.planar.parse.DiagramParserImpl;
import net.hydromatic.planar.util.PlanarException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Command-line tool that prints the contraction plan of a diagram program.
 *
 * <p>Usage: {@code planar [--property=value]... [file]}. Properties are
 * those of {@link Prop}, for example {@code --mode=symmetric} or
 * {@code --decompose=false}. If no file is given, reads the program from
 * standard input.
 */
public class Main {
  private final List<String> argList;
  private final Reader in;
  private final PrintWriter out;
  private final Map<Prop, Object> propMap = new LinkedHashMap<>();

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args), System.in, System.out);
    System.exit(main.run());
  }

  /** Creates a Main. */
  public Main(List<String> argList, InputStream in, PrintStream out) {
    this(argList, new InputStreamReader(in, StandardCharsets.UTF_8),
        new OutputStreamWriter(out, StandardCharsets.UTF_8));
  }

  /** Creates a Main. */
  public Main(List<String> argList, Reader in, Writer out) {
    this.argList = ImmutableList.copyOf(argList);
    this.in = in;
    this.out = new PrintWriter(out);
  }

  /** Runs the tool; returns the exit status. */
  public int run() {
    try {
      @Nullable String file = null;
      for (String arg : argList) {
        if (arg.startsWith("--")) {
          final int eq = arg.indexOf('=');
          if (eq < 0) {
            throw new IllegalArgumentException("expected --property=value: "
                + arg);
          }
          Prop.lookup(arg.substring(2, eq))
              .setLenient(propMap, arg.substring(eq + 1));
        } else if (file == null) {
          file = arg;
        } else {
          throw new IllegalArgumentException("more than one file: " + arg);
        }
      }
      final String text = file == null
          ? CharStreams.toString(in)
          : new String(Files.readAllBytes(Paths.get(file)),
              StandardCharsets.UTF_8);
      final PlanarCompiler compiler =
          new PlanarCompiler(propMap, Tracers.empty());
      final Diagram.Block program =
          DiagramParserImpl.create(text, file == null ? "" : file).program();
      final ContractionPlan plan = compiler.compile(program);
      out.println(plan);
      return 0;
    } catch (IOException e) {
      out.println("Error: " + e);
      return 1;
    } catch (RuntimeException e) {
      if (e instanceof PlanarException) {
        out.println(((PlanarException) e).describeTo(new StringBuilder()));
      } else {
        out.println("Error: " + e.getMessage());
      }
      return 1;
    } finally {
      out.flush();
    }
  }
}

// End Main.java

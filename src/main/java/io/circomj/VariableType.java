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

import java.util.List;
import java.util.Objects;

/**
 * Type of a declared variable: var, component, signal or signal of a bus type.
 * Signal and bus types carry their direction and the list of tags declared with them.
 */
public abstract class VariableType {

  public enum Kind { VAR, COMPONENT, SIGNAL, BUS }

  public abstract Kind getKind();

  public static final VariableType VAR       = new Simple(Kind.VAR);
  public static final VariableType COMPONENT = new Simple(Kind.COMPONENT);

  public boolean is(Kind kind) {
    return getKind() == kind;
  }

  private static class Simple extends VariableType {
    private final Kind kind;
    Simple(Kind kind)             { this.kind = kind; }
    @Override public Kind getKind() { return kind; }
    @Override public String toString() {
      return kind == Kind.VAR ? "var" : "component";
    }
  }

  public static class Signal extends VariableType {
    public final SignalType   signalType;
    public final List<String> tags;

    public Signal(SignalType signalType, List<String> tags) {
      this.signalType = signalType;
      this.tags       = List.copyOf(tags);
    }

    @Override public Kind getKind() { return Kind.SIGNAL; }

    @Override
    public boolean equals(Object o) {
      if (this == o) { return true; }
      if (!(o instanceof Signal)) { return false; }
      Signal that = (Signal) o;
      return signalType == that.signalType && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
      return Objects.hash(signalType, tags);
    }

    @Override
    public String toString() {
      return "signal " + signalType + " " + tags;
    }
  }

  public static class Bus extends VariableType {
    public final String       busName;
    public final SignalType   signalType;
    public final List<String> tags;

    public Bus(String busName, SignalType signalType, List<String> tags) {
      this.busName    = busName;
      this.signalType = signalType;
      this.tags       = List.copyOf(tags);
    }

    @Override public Kind getKind() { return Kind.BUS; }

    @Override
    public boolean equals(Object o) {
      if (this == o) { return true; }
      if (!(o instanceof Bus)) { return false; }
      Bus that = (Bus) o;
      return busName.equals(that.busName) && signalType == that.signalType && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
      return Objects.hash(busName, signalType, tags);
    }

    @Override
    public String toString() {
      return "bus " + busName + " " + signalType + " " + tags;
    }
  }
}

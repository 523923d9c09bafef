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

/**
 * One step of the access chain of a variable: either an array index "[e]" or a
 * component member ".name". Accesses are applied left to right.
 */
public abstract class Access {

  public abstract <T> T accept(Visitor<T> visitor);

  public static class ArrayIndex extends Access {
    public final Expr index;
    public ArrayIndex(Expr index) { this.index = index; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitArrayIndex(this); }
  }

  public static class ComponentMember extends Access {
    public final String name;
    public ComponentMember(String name) { this.name = name; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitComponentMember(this); }
  }

  public interface Visitor<T> {
    T visitArrayIndex(ArrayIndex access);
    T visitComponentMember(ComponentMember access);
  }
}

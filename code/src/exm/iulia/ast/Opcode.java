/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.iulia.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * Primitive operations of the target machine.  These can appear as
 * functional instructions (with arguments) or as bare instructions.
 * They are never inlined.
 */
public enum Opcode {
  // Pure arithmetic and logic: result only depends on arguments
  ADD(2, 1, true), SUB(2, 1, true), MUL(2, 1, true), DIV(2, 1, true),
  SDIV(2, 1, true), MOD(2, 1, true), SMOD(2, 1, true), EXP(2, 1, true),
  ADDMOD(3, 1, true), MULMOD(3, 1, true), SIGNEXTEND(2, 1, true),
  NOT(1, 1, true), ISZERO(1, 1, true),
  LT(2, 1, true), GT(2, 1, true), SLT(2, 1, true), SGT(2, 1, true),
  EQ(2, 1, true), AND(2, 1, true), OR(2, 1, true), XOR(2, 1, true),
  BYTE(2, 1, true), SHL(2, 1, true), SHR(2, 1, true), SAR(2, 1, true),

  // Read mutable state
  MLOAD(1, 1, false), SLOAD(1, 1, false), MSIZE(0, 1, false),
  KECCAK256(2, 1, false), CALLDATALOAD(1, 1, false),
  CALLDATASIZE(0, 1, false), CALLER(0, 1, false), CALLVALUE(0, 1, false),
  ADDRESS(0, 1, false), GAS(0, 1, false), RETURNDATASIZE(0, 1, false),

  // Side effects
  MSTORE(2, 0, false), MSTORE8(2, 0, false), SSTORE(2, 0, false),
  POP(1, 0, false), LOG0(2, 0, false), LOG1(3, 0, false),
  CALL(7, 1, false), RETURN(2, 0, false), REVERT(2, 0, false),
  STOP(0, 0, false), INVALID(0, 0, false),
  JUMP(1, 0, false), JUMPI(2, 0, false);

  private static final Map<String, Opcode> byMnemonic =
                                        new HashMap<String, Opcode>();
  static {
    for (Opcode op: values()) {
      byMnemonic.put(op.mnemonic(), op);
    }
  }

  private final int args;
  private final int returns;
  private final boolean movable;

  private Opcode(int args, int returns, boolean movable) {
    this.args = args;
    this.returns = returns;
    this.movable = movable;
  }

  public int args() {
    return args;
  }

  public int returns() {
    return returns;
  }

  /**
   * @return true if the operation has no side effects and does not read
   *         any state that can change, so it can be duplicated or moved
   */
  public boolean isMovable() {
    return movable;
  }

  public String mnemonic() {
    return name().toLowerCase();
  }

  /**
   * @param mnemonic
   * @return matching opcode, or null if not an opcode
   */
  public static Opcode fromMnemonic(String mnemonic) {
    return byMnemonic.get(mnemonic);
  }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.abi;

import java.util.List;
import java.util.Objects;

/**
 * Read-only view of one ABI function.
 *
 * @param name            function name
 * @param stateMutability {@code pure}, {@code view}, {@code nonpayable} or {@code payable}
 * @param inputs          canonical input types
 * @param outputs         canonical output types
 */
public record FunctionMetadata(String name, String stateMutability, List<String> inputs, List<String> outputs) {

    public FunctionMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(stateMutability, "stateMutability");
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    public boolean isView() {
        return "view".equals(stateMutability) || "pure".equals(stateMutability);
    }

    public boolean isPayable() {
        return "payable".equals(stateMutability);
    }

    /**
     * The signature hashed into the selector, e.g. {@code transfer(address,uint256)}.
     */
    public String signature() {
        return name + "(" + String.join(",", inputs) + ")";
    }
}

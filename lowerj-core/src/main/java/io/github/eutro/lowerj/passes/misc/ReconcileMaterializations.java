package io.github.eutro.lowerj.passes.misc;

import io.github.eutro.lowerj.ir.IRUtils;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Module;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.BuiltinOps;
import io.github.eutro.lowerj.passes.InPlaceIRPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes the casts a conversion no longer needs.
 * <p>
 * A cast to its own type, or a cast back to the type a preceding cast started from, is bypassed.
 * Casts without users are then erased. Casts between genuinely different types are left in place.
 */
public class ReconcileMaterializations implements InPlaceIRPass<Module> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReconcileMaterializations.class);

    public static final ReconcileMaterializations INSTANCE = new ReconcileMaterializations();

    @Override
    public void runInPlace(Module module) {
        int removed = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            List<Insn> casts = new ArrayList<>();
            IRUtils.walk(module, insn -> {
                if (BuiltinOps.isMaterialization(insn)) casts.add(insn);
            });
            // reverse, so chains are erased from their last link
            for (int i = casts.size() - 1; i >= 0; i--) {
                Insn cast = casts.get(i);
                if (cast.isErased()) continue;
                Var input = cast.getOperands().get(0);
                Var output = cast.result();
                if (input.getType().equals(output.getType())) {
                    output.replaceAllUsesWith(input);
                } else {
                    Insn def = input.getDefiningInsn();
                    if (def != null && BuiltinOps.isMaterialization(def)) {
                        Var original = def.getOperands().get(0);
                        if (original.getType().equals(output.getType())) {
                            output.replaceAllUsesWith(original);
                        }
                    }
                }
                if (!output.hasUses()) {
                    cast.erase();
                    removed++;
                    changed = true;
                }
            }
        }
        if (removed > 0) {
            LOGGER.debug("removed {} redundant casts", removed);
        }
    }
}

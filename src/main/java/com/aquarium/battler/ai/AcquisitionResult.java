package com.aquarium.battler.ai;

import java.util.List;

/**
 * Outcome of one AI shopping pass.
 *
 * @param remainingGold gold left after every purchase
 * @param spent         gold spent this pass
 * @param bought        names of the pieces bought, in order
 * @param replaced      names of the pieces sold off to make room
 */
public record AcquisitionResult(int remainingGold, int spent, List<String> bought, List<String> replaced) {

    public AcquisitionResult {
        bought = List.copyOf(bought);
        replaced = List.copyOf(replaced);
    }
}

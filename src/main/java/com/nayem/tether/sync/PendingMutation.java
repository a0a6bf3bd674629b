package com.nayem.tether.sync;

import com.nayem.tether.core.CollapsedMutation;

public record PendingMutation(String identifier, CollapsedMutation mutation) {
}

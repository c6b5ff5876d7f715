package dev.kestrel.compiler;

import java.util.ArrayList;
import java.util.List;

/** Pending {@code break}/{@code continue} jumps of the innermost enclosing loop. */
final class LoopContext {
    final List<Integer> breakJumps = new ArrayList<>();
    final List<Integer> continueJumps = new ArrayList<>();
}

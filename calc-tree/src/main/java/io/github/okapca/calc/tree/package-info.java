/// Symbolic arithmetic trees with two outputs from one source of truth.
///
/// A tree built with the [io.github.okapca.calc.tree.CalcTree] factory functions can
/// be folded to a `double` once every reference is bound, or rendered to CSS
/// `calc()` text while references remain free. Both outputs come from the same
/// [io.github.okapca.calc.tree.CalcNode] algebra, so they agree.
///
/// Sub-trees wrapped with `asProperty` are hoisted into custom property
/// declarations during rendering; reusing a name for different text fails the
/// whole render with [io.github.okapca.calc.tree.DeclarationConflictException].
package io.github.okapca.calc.tree;

package scadlite.ast.args;

public sealed interface TransformArgs
        permits TranslateArgs, RotateArgs, ScaleArgs, MirrorArgs,
        ResizeArgs, MultmatrixArgs, ColorArgs, OffsetArgs, NoArgs {}

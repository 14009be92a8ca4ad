package com.discernus.pipeline;

import com.discernus.gasket.PayloadSchema;
import com.discernus.pipeline.PipelineDefinition.StageDefinition;

/**
 * Supplies the payload schema for a stage. The default reads the schema declared
 * in the pipeline file; rubric evaluators can plug in their own.
 */
@FunctionalInterface
public interface SchemaProvider {
    SchemaProvider DECLARED = StageDefinition::declaredSchema;

    PayloadSchema schemaFor(StageDefinition stage);
}

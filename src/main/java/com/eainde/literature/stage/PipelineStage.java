package com.eainde.literature.stage;

import com.eainde.literature.model.Document;
import com.eainde.literature.model.Stage;

/**
 * One unit of pipeline work for one document. Implementations persist their own
 * payload through {@link StageContext#commit} and throw on failure; status
 * bookkeeping belongs to the caller.
 */
public interface PipelineStage {

    Stage stage();

    StageReport run(Document document, StageContext context) throws Exception;
}

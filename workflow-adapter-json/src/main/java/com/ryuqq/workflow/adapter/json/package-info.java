/**
 * JSON Template Store adapter.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.adapter.json.JsonTemplateParser}: structural parse of template documents (Jackson)</li>
 *   <li>{@link com.ryuqq.workflow.adapter.json.FileSystemTemplateStore}: resolves
 *       {@code <type>_<project>.json} then {@code <type>.json} from a directory</li>
 * </ul>
 *
 * @see com.ryuqq.workflow.core.spi.TemplateStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.adapter.json;

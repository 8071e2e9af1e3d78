/**
 * Jackson 설정.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.adapter.file.json;

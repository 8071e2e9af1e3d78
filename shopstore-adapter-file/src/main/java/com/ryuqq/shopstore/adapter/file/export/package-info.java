/**
 * 상점 이관 번들 코덱.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.adapter.file.export;

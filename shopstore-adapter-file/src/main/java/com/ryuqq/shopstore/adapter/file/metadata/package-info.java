/**
 * File-based metadata index ({@code {id}-metadata.json}).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.adapter.file.metadata;

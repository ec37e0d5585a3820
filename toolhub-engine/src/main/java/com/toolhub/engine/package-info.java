/**
 * Call execution: argument validation, dispatch, failure classification and policy, result
 * cache, metrics and the {@link com.toolhub.engine.ToolEngine} facade with its configuration.
 */
package com.toolhub.engine;

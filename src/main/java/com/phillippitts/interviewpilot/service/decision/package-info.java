/**
 * Follow-up decisions: answer scoring SPI, local and remote scorers, and the rule-ordered engine.
 */
package com.phillippitts.interviewpilot.service.decision;

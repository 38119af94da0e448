/**
 * Question plan intake: drafts from clients or the matching subsystem, defaults and validation.
 */
package com.phillippitts.interviewpilot.service.plan;

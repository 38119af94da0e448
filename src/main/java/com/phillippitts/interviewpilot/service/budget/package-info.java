/**
 * Time budget allocation across pending plan items.
 */
package com.phillippitts.interviewpilot.service.budget;

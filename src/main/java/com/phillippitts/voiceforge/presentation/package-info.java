/**
 * REST boundary: pool capacity, turn metrics, direct task submission and exception mapping.
 * Controllers are thin adapters over the service layer.
 */
package com.phillippitts.voiceforge.presentation;

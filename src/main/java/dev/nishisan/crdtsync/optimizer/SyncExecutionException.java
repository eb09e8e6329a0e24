/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.crdtsync.optimizer;

/**
 * A scheduled sync could not deliver its delta to the peer.
 */
public class SyncExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String peerId;

    public SyncExecutionException(String peerId, String message) {
        super(message);
        this.peerId = peerId;
    }

    public SyncExecutionException(String peerId, String message, Throwable cause) {
        super(message, cause);
        this.peerId = peerId;
    }

    public String peerId() {
        return peerId;
    }
}
